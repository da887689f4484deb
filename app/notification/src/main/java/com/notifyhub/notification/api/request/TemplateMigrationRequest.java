/*
 * どこで: Notification API リクエスト DTO
 * 何を: テンプレート移行 API の入力を定義する
 * なぜ: dry-run と commit を 1 つのエンドポイントで切り替えるため
 */
package com.notifyhub.notification.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TemplateMigrationRequest(Boolean dryRun) {

  /** 本文や dry_run が省略された場合は commit として扱う。 */
  public boolean dryRunOrDefault() {
    return Boolean.TRUE.equals(dryRun);
  }
}
