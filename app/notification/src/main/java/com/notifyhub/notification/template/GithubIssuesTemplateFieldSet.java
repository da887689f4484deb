package com.notifyhub.notification.template;

import com.notifyhub.notification.model.GithubIssueDuplicate;
import com.notifyhub.notification.model.GithubIssueSearch;
import com.notifyhub.notification.model.GithubIssuesTemplate;
import java.util.List;
import java.util.Map;

/**
 * GitHub Issues: organization/repository/title/body、unique_search の str と author、assignees と labels
 * の各要素、on_duplicate の comment と labels の各要素。
 */
final class GithubIssuesTemplateFieldSet implements TemplateFieldSet<GithubIssuesTemplate> {

  static final String ORGANIZATION = "organization";
  static final String REPOSITORY = "repository";
  static final String TITLE = "title";
  static final String BODY = "body";
  static final String UNIQUE_SEARCH_STR = "unique_search.str";
  static final String UNIQUE_SEARCH_AUTHOR = "unique_search.author";
  static final String ASSIGNEES = "assignees";
  static final String LABELS = "labels";
  static final String ON_DUPLICATE_COMMENT = "on_duplicate.comment";
  static final String ON_DUPLICATE_LABELS = "on_duplicate.labels";

  @Override
  public List<TemplateField> extract(GithubIssuesTemplate config) {
    final TemplateFieldCollector collector =
        new TemplateFieldCollector()
            .scalar(ORGANIZATION, config.organization())
            .scalar(REPOSITORY, config.repository())
            .scalar(TITLE, config.title())
            .scalar(BODY, config.body());
    final GithubIssueSearch uniqueSearch = config.uniqueSearch();
    if (uniqueSearch != null) {
      collector
          .scalar(UNIQUE_SEARCH_STR, uniqueSearch.str())
          .scalar(UNIQUE_SEARCH_AUTHOR, uniqueSearch.author());
    }
    collector.listItems(ASSIGNEES, config.assignees()).listItems(LABELS, config.labels());
    final GithubIssueDuplicate onDuplicate = config.onDuplicate();
    if (onDuplicate != null) {
      collector
          .scalar(ON_DUPLICATE_COMMENT, onDuplicate.comment())
          .listItems(ON_DUPLICATE_LABELS, onDuplicate.labels());
    }
    return collector.fields();
  }

  @Override
  public GithubIssuesTemplate rebuild(
      GithubIssuesTemplate config, Map<FieldLocator, String> updates) {
    final TemplateFieldUpdates fieldUpdates = new TemplateFieldUpdates(updates);
    final GithubIssueSearch uniqueSearch = config.uniqueSearch();
    final GithubIssueDuplicate onDuplicate = config.onDuplicate();
    final GithubIssuesTemplate rebuilt =
        config.withTemplates(
            fieldUpdates.scalar(ORGANIZATION, config.organization()),
            fieldUpdates.scalar(REPOSITORY, config.repository()),
            fieldUpdates.scalar(TITLE, config.title()),
            fieldUpdates.scalar(BODY, config.body()),
            uniqueSearch == null
                ? null
                : uniqueSearch.withTemplates(
                    fieldUpdates.scalar(UNIQUE_SEARCH_STR, uniqueSearch.str()),
                    fieldUpdates.scalar(UNIQUE_SEARCH_AUTHOR, uniqueSearch.author())),
            fieldUpdates.listItems(ASSIGNEES, config.assignees()),
            fieldUpdates.listItems(LABELS, config.labels()),
            onDuplicate == null
                ? null
                : onDuplicate.withTemplates(
                    fieldUpdates.listItems(ON_DUPLICATE_LABELS, onDuplicate.labels()),
                    fieldUpdates.scalar(ON_DUPLICATE_COMMENT, onDuplicate.comment())));
    fieldUpdates.verifyAllApplied();
    return rebuilt;
  }
}
