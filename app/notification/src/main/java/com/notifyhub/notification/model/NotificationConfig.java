/*
 * どこで: Notification ドメインモデル
 * 何を: チャネルごとの通知設定を束ねる閉じた型
 * なぜ: 保存 JSON の type タグから具象レコードへ復元し、既知の種別だけを扱うため
 */
package com.notifyhub.notification.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "notification_type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = AdoTemplate.class, name = "ado"),
  @JsonSubTypes.Type(value = GithubIssuesTemplate.class, name = "github_issues"),
  @JsonSubTypes.Type(value = TeamsTemplate.class, name = "teams")
})
public sealed interface NotificationConfig
    permits AdoTemplate, GithubIssuesTemplate, TeamsTemplate {

  NotificationConfigType configType();

  /** API 応答用に秘密情報を伏せたコピーを返す。 */
  NotificationConfig withRedactedSecrets();
}
