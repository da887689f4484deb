/*
 * どこで: Notification ドメインモデル
 * 何を: 認証トークンや Webhook URL などの秘密値を包む
 * なぜ: テンプレートではない値を型で区別し、ログや API 応答へ漏らさないため
 */
package com.notifyhub.notification.model;

public record SecretData<T>(T value) {

  public static <T> SecretData<T> redacted() {
    return new SecretData<>(null);
  }

  @Override
  public String toString() {
    return "SecretData[****]";
  }
}
