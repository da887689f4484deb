/*
 * どこで: Notification API
 * 何を: 通知設定の未検出を表現する
 * なぜ: 参照 API の 404 応答へ変換するため
 */
package com.notifyhub.notification.api;

import java.util.UUID;

public class NotificationConfigNotFoundException extends RuntimeException {
  public NotificationConfigNotFoundException(UUID notificationId) {
    super("notification config not found: " + notificationId);
  }
}
