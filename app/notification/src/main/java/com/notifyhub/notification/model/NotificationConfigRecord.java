/*
 * どこで: Notification ドメインモデル
 * 何を: notification_configs テーブルのスナップショット
 * なぜ: etag を版トークンとして持ち回り、楽観的排他で更新するため
 */
package com.notifyhub.notification.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationConfigRecord(
    UUID notificationId,
    String container,
    NotificationConfig config,
    UUID etag,
    Instant updatedAt) {

  public NotificationConfigRecord withConfig(
      NotificationConfig newConfig, UUID newEtag, Instant newUpdatedAt) {
    return new NotificationConfigRecord(notificationId, container, newConfig, newEtag, newUpdatedAt);
  }
}
