/*
 * どこで: Notification サービスのテスト補助
 * 何を: etag 比較更新を持つメモリ上の通知設定リポジトリ
 * なぜ: 競合や書き込み失敗を 1 件単位で差し込み、バッチ継続を検証するため
 */
package com.notifyhub.notification.service;

import com.notifyhub.notification.model.NotificationConfigRecord;
import com.notifyhub.notification.repository.NotificationConfigRepository;
import com.notifyhub.notification.repository.NotificationConfigRow;
import com.notifyhub.notification.repository.NotificationConfigUpdateResult;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

class InMemoryNotificationConfigRepository implements NotificationConfigRepository {

  private final Map<UUID, NotificationConfigRecord> records = new LinkedHashMap<>();
  private final Map<UUID, String> undecodable = new LinkedHashMap<>();
  private final Set<UUID> failingWrites = new HashSet<>();
  private final Map<UUID, Consumer<InMemoryNotificationConfigRepository>> beforeWrite =
      new HashMap<>();
  private final List<UUID> writeAttempts = new ArrayList<>();

  @Override
  public void insert(NotificationConfigRecord record) {
    records.put(record.notificationId(), record);
  }

  @Override
  public List<NotificationConfigRow> findAll() {
    final List<NotificationConfigRow> rows = new ArrayList<>();
    records.values().forEach(record -> rows.add(NotificationConfigRow.decoded(record)));
    undecodable.forEach((id, error) -> rows.add(NotificationConfigRow.undecodable(id, error)));
    return rows;
  }

  @Override
  public Optional<NotificationConfigRecord> findById(UUID notificationId) {
    return Optional.ofNullable(records.get(notificationId));
  }

  @Override
  public List<NotificationConfigRecord> findByContainer(String container) {
    return records.values().stream().filter(r -> r.container().equals(container)).toList();
  }

  @Override
  public NotificationConfigUpdateResult updateIfVersionMatches(
      NotificationConfigRecord record, UUID expectedEtag) {
    writeAttempts.add(record.notificationId());
    final Consumer<InMemoryNotificationConfigRepository> hook =
        beforeWrite.remove(record.notificationId());
    if (hook != null) {
      hook.accept(this);
    }
    if (failingWrites.contains(record.notificationId())) {
      throw new IllegalStateException("injected write failure id=" + record.notificationId());
    }
    final NotificationConfigRecord current = records.get(record.notificationId());
    if (current == null) {
      return NotificationConfigUpdateResult.NOT_FOUND;
    }
    if (!current.etag().equals(expectedEtag)) {
      return NotificationConfigUpdateResult.VERSION_CONFLICT;
    }
    records.put(record.notificationId(), record);
    return NotificationConfigUpdateResult.UPDATED;
  }

  /** 保存内容が壊れていて設定を復元できない行を置く。 */
  void insertUndecodable(UUID notificationId, String decodeError) {
    undecodable.put(notificationId, decodeError);
  }

  void failWritesFor(UUID notificationId) {
    failingWrites.add(notificationId);
  }

  /** 書き込み直前に別の更新が割り込んだ状態を再現する。 */
  void concurrentlyModify(UUID notificationId) {
    beforeWrite.put(
        notificationId,
        repository -> {
          final NotificationConfigRecord current = repository.records.get(notificationId);
          repository.records.put(
              notificationId,
              current.withConfig(current.config(), UUID.randomUUID(), current.updatedAt()));
        });
  }

  void concurrentlyDelete(UUID notificationId) {
    beforeWrite.put(notificationId, repository -> repository.records.remove(notificationId));
  }

  NotificationConfigRecord get(UUID notificationId) {
    return records.get(notificationId);
  }

  List<UUID> writeAttempts() {
    return List.copyOf(writeAttempts);
  }
}
