package com.notifyhub.notification.repository;

/** 保存済みの config_json を通知設定として復元できなかったことを示す。 */
public class NotificationConfigDecodeException extends IllegalStateException {

  public NotificationConfigDecodeException(String message) {
    super(message);
  }

  public NotificationConfigDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
