/*
 * どこで: Notification ドメインモデル
 * 何を: Teams Webhook への通知設定
 * なぜ: Webhook URL だけを秘密値として保持し、テンプレートを持たない種別を表すため
 */
package com.notifyhub.notification.model;

public record TeamsTemplate(SecretData<String> url) implements NotificationConfig {

  @Override
  public NotificationConfigType configType() {
    return NotificationConfigType.TEAMS;
  }

  @Override
  public TeamsTemplate withRedactedSecrets() {
    return new TeamsTemplate(SecretData.redacted());
  }
}
