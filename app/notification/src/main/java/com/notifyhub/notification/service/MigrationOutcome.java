/*
 * どこで: テンプレート移行サービス層
 * 何を: 1 件の通知設定に対する移行結果を表す
 * なぜ: 失敗理由をログへ残しつつ、応答には ID だけを返すため
 */
package com.notifyhub.notification.service;

public record MigrationOutcome(Kind kind, String reason) {

  public enum Kind {
    /** 移行対象のフィールドが無い。 */
    UNCHANGED,
    /** dry-run で移行対象と判定した。 */
    WOULD_UPDATE,
    UPDATED,
    FAILED
  }

  private static final MigrationOutcome UNCHANGED = new MigrationOutcome(Kind.UNCHANGED, null);
  private static final MigrationOutcome WOULD_UPDATE =
      new MigrationOutcome(Kind.WOULD_UPDATE, null);
  private static final MigrationOutcome UPDATED = new MigrationOutcome(Kind.UPDATED, null);

  public static MigrationOutcome unchanged() {
    return UNCHANGED;
  }

  public static MigrationOutcome wouldUpdate() {
    return WOULD_UPDATE;
  }

  public static MigrationOutcome updated() {
    return UPDATED;
  }

  public static MigrationOutcome failed(String reason) {
    return new MigrationOutcome(Kind.FAILED, reason == null ? "unknown error" : reason);
  }
}
