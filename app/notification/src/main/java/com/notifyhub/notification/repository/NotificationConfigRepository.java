/*
 * どこで: Notification Repository 層
 * 何を: 通知設定の永続化操作を抽象化する
 * なぜ: 移行処理を保存方式から切り離し、etag による比較更新を契約として明示するため
 */
package com.notifyhub.notification.repository;

import com.notifyhub.notification.model.NotificationConfigRecord;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface NotificationConfigRepository {

  /** 役割: 新しい通知設定を登録する。 前提: notificationId と etag は採番済みであること。 */
  void insert(NotificationConfigRecord record);

  /**
   * 役割: 全件を返す。 動作: 保存側での絞り込みは行わない。設定を復元できない行も例外にせず、理由付きの行として返す。
   */
  List<NotificationConfigRow> findAll();

  Optional<NotificationConfigRecord> findById(UUID notificationId);

  List<NotificationConfigRecord> findByContainer(String container);

  /**
   * 役割: 保存済みの etag が expectedEtag と一致するときだけ config/etag/updated_at を書き換える。 動作: 一致しなければ
   * VERSION_CONFLICT、行が無ければ NOT_FOUND を返し、上書きはしない。再試行もしない。
   */
  NotificationConfigUpdateResult updateIfVersionMatches(
      NotificationConfigRecord record, UUID expectedEtag);
}
