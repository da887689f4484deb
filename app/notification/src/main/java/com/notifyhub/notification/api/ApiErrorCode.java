/*
 * どこで: Notification API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.notifyhub.notification.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  NOT_FOUND,
  INSTANCE_CONFIG_CONFLICT,
  INTERNAL_ERROR
}
