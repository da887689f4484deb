/*
 * どこで: テンプレート移行サービス層
 * 何を: 通知ごとの移行結果を would-update/updated/failed/unchanged に振り分ける
 * なぜ: 1 回の実行で同じ ID が複数の区分に現れないことを保証するため
 */
package com.notifyhub.notification.service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

public class TemplateMigrationResultAggregator {

  private final Map<MigrationOutcome.Kind, List<UUID>> buckets =
      new EnumMap<>(MigrationOutcome.Kind.class);
  private final Set<UUID> seen = new HashSet<>();

  public TemplateMigrationResultAggregator() {
    for (MigrationOutcome.Kind kind : MigrationOutcome.Kind.values()) {
      buckets.put(kind, new ArrayList<>());
    }
  }

  public void add(UUID notificationId, MigrationOutcome outcome) {
    if (!seen.add(notificationId)) {
      throw new IllegalStateException("notification already aggregated id=" + notificationId);
    }
    buckets.get(outcome.kind()).add(notificationId);
  }

  public int processedCount() {
    return seen.size();
  }

  public int count(MigrationOutcome.Kind kind) {
    return buckets.get(kind).size();
  }

  public TemplateMigrationResult toResult(boolean dryRun) {
    return new TemplateMigrationResult(
        dryRun,
        buckets.get(MigrationOutcome.Kind.WOULD_UPDATE),
        buckets.get(MigrationOutcome.Kind.UPDATED),
        // dry-run の計画失敗はログにだけ残し、応答には載せない
        dryRun ? List.of() : buckets.get(MigrationOutcome.Kind.FAILED),
        buckets.get(MigrationOutcome.Kind.UNCHANGED));
  }
}
