package com.notifyhub.notification.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** 既存 Issue を探すための検索条件。str と author はテンプレート。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GithubIssueSearch(List<GithubIssueSearchMatch> fieldMatch, String str, String author) {

  public GithubIssueSearch {
    fieldMatch = ModelCollections.immutableList(fieldMatch);
  }

  public GithubIssueSearch withTemplates(String str, String author) {
    return new GithubIssueSearch(fieldMatch, str, author);
  }
}
