/*
 * どこで: テンプレート移行サービス層
 * 何を: 全通知設定を走査し、旧記法のテンプレートを新記法へ移行する(dry-run/commit)
 * なぜ: 1 件の失敗でバッチを止めず、etag による比較更新で同時編集を上書きしないため
 */
package com.notifyhub.notification.service;

import com.google.common.annotations.VisibleForTesting;
import com.notifyhub.notification.model.NotificationConfig;
import com.notifyhub.notification.model.NotificationConfigRecord;
import com.notifyhub.notification.repository.NotificationConfigRepository;
import com.notifyhub.notification.repository.NotificationConfigRow;
import com.notifyhub.notification.repository.NotificationConfigUpdateResult;
import com.notifyhub.notification.template.FieldLocator;
import com.notifyhub.notification.template.LegacyTemplateDetector;
import com.notifyhub.notification.template.TemplateField;
import com.notifyhub.notification.template.TemplateFieldEnumerator;
import com.notifyhub.notification.template.TemplateSyntaxAdapter;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TemplateMigrationService {

  private static final Logger logger = LoggerFactory.getLogger(TemplateMigrationService.class);

  private final NotificationConfigRepository notificationConfigRepository;
  private final TemplateFieldEnumerator fieldEnumerator;
  private final LegacyTemplateDetector detector;
  private final TemplateSyntaxAdapter adapter;
  private final TemplateMigrationMetrics metrics;
  private final Clock clock;

  /**
   * 役割: 保存済みの全通知設定に移行を適用する。
   *
   * <p>期待動作:
   *
   * <ul>
   *   <li>dry-run は再構築も書き込みもせず、移行対象の ID だけを返す。
   *   <li>commit は通知ごとに etag 付きで更新し、競合/消失/不整合はその通知だけを failed にして続行する。
   *   <li>保存内容を復元できない通知は、どちらのモードでもその通知だけを failed にする(dry-run では移行対象に含めない)。
   *   <li>割り込まれた場合は処理済みの通知だけを結果に含める。書き込み済みの通知は戻さない。
   * </ul>
   */
  public TemplateMigrationResult migrate(boolean dryRun) {
    final List<NotificationConfigRow> rows = notificationConfigRepository.findAll();
    final TemplateMigrationResultAggregator aggregator = new TemplateMigrationResultAggregator();
    logger.info("template migration started dryRun={} total={}", dryRun, rows.size());
    for (NotificationConfigRow row : rows) {
      if (Thread.currentThread().isInterrupted()) {
        logger.warn(
            "template migration interrupted dryRun={} processed={} total={}",
            dryRun,
            aggregator.processedCount(),
            rows.size());
        break;
      }
      final MigrationOutcome outcome = migrateRow(row, dryRun);
      aggregator.add(row.notificationId(), outcome);
      metrics.recordOutcome(outcome.kind());
    }
    metrics.recordRun(dryRun);
    logger.info(
        "template migration finished dryRun={} unchanged={} wouldUpdate={} updated={} failed={}",
        dryRun,
        aggregator.count(MigrationOutcome.Kind.UNCHANGED),
        aggregator.count(MigrationOutcome.Kind.WOULD_UPDATE),
        aggregator.count(MigrationOutcome.Kind.UPDATED),
        aggregator.count(MigrationOutcome.Kind.FAILED));
    return aggregator.toResult(dryRun);
  }

  private MigrationOutcome migrateRow(NotificationConfigRow row, boolean dryRun) {
    if (!row.isDecoded()) {
      logger.warn(
          "notification config could not be decoded id={} reason={}",
          row.notificationId(),
          row.decodeError());
      return MigrationOutcome.failed(row.decodeError());
    }
    return dryRun ? planOnly(row.record()) : commit(row.record());
  }

  private MigrationOutcome planOnly(NotificationConfigRecord record) {
    try {
      return plan(record).isEmpty() ? MigrationOutcome.unchanged() : MigrationOutcome.wouldUpdate();
    } catch (RuntimeException ex) {
      logger.warn("template migration plan failed id={}", record.notificationId(), ex);
      return MigrationOutcome.failed(ex.getMessage());
    }
  }

  private MigrationOutcome commit(NotificationConfigRecord record) {
    try {
      final Map<FieldLocator, String> updates = plan(record);
      if (updates.isEmpty()) {
        return MigrationOutcome.unchanged();
      }
      final NotificationConfig migrated = fieldEnumerator.rebuild(record.config(), updates);
      final NotificationConfigRecord next =
          record.withConfig(migrated, UUID.randomUUID(), Instant.now(clock));
      final NotificationConfigUpdateResult result =
          notificationConfigRepository.updateIfVersionMatches(next, record.etag());
      if (result == NotificationConfigUpdateResult.UPDATED) {
        logger.info(
            "notification config migrated id={} fields={}", record.notificationId(), updates.size());
        return MigrationOutcome.updated();
      }
      logger.warn(
          "notification config migration skipped id={} result={}", record.notificationId(), result);
      return MigrationOutcome.failed(result.name());
    } catch (RuntimeException ex) {
      // 不整合な設定や DB 例外もこの通知だけの失敗として扱い、次の通知へ進む
      logger.warn("notification config migration failed id={}", record.notificationId(), ex);
      return MigrationOutcome.failed(ex.getMessage());
    }
  }

  /** 移行対象フィールドの位置と変換後の値。対象が無ければ空。 */
  @VisibleForTesting
  Map<FieldLocator, String> plan(NotificationConfigRecord record) {
    final Map<FieldLocator, String> updates = new LinkedHashMap<>();
    for (TemplateField field : fieldEnumerator.extract(record.config())) {
      if (detector.needsMigration(field.value())) {
        updates.put(field.locator(), adapter.adapt(field.value()));
      }
    }
    return updates;
  }
}
