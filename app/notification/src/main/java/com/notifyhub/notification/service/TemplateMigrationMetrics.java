/*
 * どこで: テンプレート移行サービス層
 * 何を: 移行の実行回数と通知ごとの結果件数をメトリクスとして記録する
 * なぜ: 失敗件数の推移を Prometheus から観測し、再実行の要否を判断できるようにするため
 */
package com.notifyhub.notification.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class TemplateMigrationMetrics {

  private static final String METRIC_RUNS_TOTAL = "notification.template_migration.runs.total";
  private static final String METRIC_RECORDS_TOTAL =
      "notification.template_migration.records.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> runCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<MigrationOutcome.Kind, Counter> recordCounters =
      new ConcurrentHashMap<>();

  public TemplateMigrationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordRun(boolean dryRun) {
    final String mode = dryRun ? "dry_run" : "commit";
    runCounters
        .computeIfAbsent(
            mode,
            ignored ->
                Counter.builder(METRIC_RUNS_TOTAL)
                    .description("Template migration invocations")
                    .tags(Tags.of("mode", mode))
                    .register(meterRegistry))
        .increment();
  }

  public void recordOutcome(MigrationOutcome.Kind kind) {
    recordCounters
        .computeIfAbsent(
            kind,
            ignored ->
                Counter.builder(METRIC_RECORDS_TOTAL)
                    .description("Per-notification template migration outcomes")
                    .tags(Tags.of("outcome", kind.name().toLowerCase(Locale.ROOT)))
                    .register(meterRegistry))
        .increment();
  }
}
