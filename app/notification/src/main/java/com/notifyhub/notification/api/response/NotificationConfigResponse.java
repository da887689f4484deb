package com.notifyhub.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notifyhub.notification.model.NotificationConfig;
import com.notifyhub.notification.model.NotificationConfigRecord;
import java.time.Instant;
import java.util.UUID;

/** 通知設定の参照結果。秘密値は常に伏せて返す。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationConfigResponse(
    UUID notificationId, String container, NotificationConfig config, UUID etag, Instant updatedAt) {

  public static NotificationConfigResponse from(NotificationConfigRecord record) {
    return new NotificationConfigResponse(
        record.notificationId(),
        record.container(),
        record.config().withRedactedSecrets(),
        record.etag(),
        record.updatedAt());
  }
}
