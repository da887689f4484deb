/*
 * どこで: Notification Repository 層
 * 何を: 全件読み出し時の 1 行分の結果(復元できた設定か、復元できなかった理由)
 * なぜ: 壊れた行が 1 件あっても読み出し全体を失敗させず、その通知だけを呼び出し側で失敗扱いにするため
 */
package com.notifyhub.notification.repository;

import com.notifyhub.notification.model.NotificationConfigRecord;
import java.util.UUID;

public record NotificationConfigRow(
    UUID notificationId, NotificationConfigRecord record, String decodeError) {

  public static NotificationConfigRow decoded(NotificationConfigRecord record) {
    return new NotificationConfigRow(record.notificationId(), record, null);
  }

  public static NotificationConfigRow undecodable(UUID notificationId, String decodeError) {
    return new NotificationConfigRow(notificationId, null, decodeError);
  }

  public boolean isDecoded() {
    return record != null;
  }
}
