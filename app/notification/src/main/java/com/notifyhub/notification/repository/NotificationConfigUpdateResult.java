package com.notifyhub.notification.repository;

/** etag 付き更新の結果。 */
public enum NotificationConfigUpdateResult {
  UPDATED,
  VERSION_CONFLICT,
  NOT_FOUND
}
