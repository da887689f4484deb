package com.notifyhub.notification.service;

import java.util.List;
import java.util.UUID;

/**
 * 1 回の移行実行の結果。各リストの順序に意味はなく、集合として比較すること。
 *
 * <p>dry-run では notificationIdsToUpdate だけが、commit では updated/failed だけが埋まる。
 */
public record TemplateMigrationResult(
    boolean dryRun,
    List<UUID> notificationIdsToUpdate,
    List<UUID> updatedNotificationIds,
    List<UUID> failedNotificationIds,
    List<UUID> unchangedNotificationIds) {

  public TemplateMigrationResult {
    notificationIdsToUpdate = List.copyOf(notificationIdsToUpdate);
    updatedNotificationIds = List.copyOf(updatedNotificationIds);
    failedNotificationIds = List.copyOf(failedNotificationIds);
    unchangedNotificationIds = List.copyOf(unchangedNotificationIds);
  }
}
