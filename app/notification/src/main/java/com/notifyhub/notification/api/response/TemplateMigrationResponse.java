/*
 * どこで: Notification API レスポンス DTO
 * 何を: commit 時の更新済み/失敗 ID 一覧を返す
 * なぜ: 失敗した通知だけを再実行や手動確認の対象にできるようにするため
 */
package com.notifyhub.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TemplateMigrationResponse(
    List<UUID> updatedNotificationIds, List<UUID> failedNotificationIds) {

  public TemplateMigrationResponse {
    updatedNotificationIds = List.copyOf(updatedNotificationIds);
    failedNotificationIds = List.copyOf(failedNotificationIds);
  }
}
