/*
 * どこで: Notification ドメインモデル
 * 何を: GitHub Issue 起票用の通知設定
 * なぜ: タイトル/本文/ラベルなどのテンプレート文字列と認証情報を一体で保存するため
 */
package com.notifyhub.notification.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GithubIssuesTemplate(
    SecretData<GithubAuth> auth,
    String organization,
    String repository,
    String title,
    String body,
    GithubIssueSearch uniqueSearch,
    List<String> assignees,
    List<String> labels,
    GithubIssueDuplicate onDuplicate)
    implements NotificationConfig {

  public GithubIssuesTemplate {
    assignees = ModelCollections.immutableList(assignees);
    labels = ModelCollections.immutableList(labels);
  }

  @Override
  public NotificationConfigType configType() {
    return NotificationConfigType.GITHUB_ISSUES;
  }

  @Override
  public GithubIssuesTemplate withRedactedSecrets() {
    return new GithubIssuesTemplate(
        SecretData.redacted(),
        organization,
        repository,
        title,
        body,
        uniqueSearch,
        assignees,
        labels,
        onDuplicate);
  }

  public GithubIssuesTemplate withTemplates(
      String organization,
      String repository,
      String title,
      String body,
      GithubIssueSearch uniqueSearch,
      List<String> assignees,
      List<String> labels,
      GithubIssueDuplicate onDuplicate) {
    return new GithubIssuesTemplate(
        auth, organization, repository, title, body, uniqueSearch, assignees, labels, onDuplicate);
  }
}
