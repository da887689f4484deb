/*
 * どこで: Notification API
 * 何を: インスタンス設定の etag 不一致を表現する
 * なぜ: 管理者一覧の同時更新を 409 応答へ変換するため
 */
package com.notifyhub.notification.api;

public class InstanceConfigConflictException extends RuntimeException {
  public InstanceConfigConflictException(String message) {
    super(message);
  }
}
