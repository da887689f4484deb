/*
 * どこで: Notification API レスポンス DTO
 * 何を: dry-run 時の移行対象 ID 一覧を返す
 * なぜ: 書き込み前に影響範囲を確認できるようにするため
 */
package com.notifyhub.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TemplateMigrationDryRunResponse(List<UUID> notificationIdsToUpdate) {

  public TemplateMigrationDryRunResponse {
    notificationIdsToUpdate = List.copyOf(notificationIdsToUpdate);
  }
}
