/*
 * どこで: Notification サービス層
 * 何を: インスタンス設定を有効期間付きで 1 件だけ保持する
 * なぜ: 認可判定ごとに DB を読まず、期限切れ時の同時読み込みを 1 回にまとめるため
 */
package com.notifyhub.notification.service;

import com.notifyhub.notification.model.InstanceConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

class InstanceConfigCache {

  private final Clock clock;
  private final Duration ttl;
  private final Object lock = new Object();
  private volatile Entry entry;

  InstanceConfigCache(Clock clock, Duration ttl) {
    this.clock = clock;
    this.ttl = ttl;
  }

  /** 有効なエントリが無ければ loader を 1 回だけ呼ぶ。存在しない設定はキャッシュしない。 */
  Optional<InstanceConfig> get(Supplier<Optional<InstanceConfig>> loader) {
    final Entry current = entry;
    if (current != null && current.isFresh(clock.instant())) {
      return Optional.of(current.value());
    }
    synchronized (lock) {
      final Entry latest = entry;
      if (latest != null && latest.isFresh(clock.instant())) {
        return Optional.of(latest.value());
      }
      final Optional<InstanceConfig> loaded = loader.get();
      entry = loaded.map(this::newEntry).orElse(null);
      return loaded;
    }
  }

  void put(InstanceConfig value) {
    synchronized (lock) {
      entry = newEntry(value);
    }
  }

  void invalidate() {
    synchronized (lock) {
      entry = null;
    }
  }

  private Entry newEntry(InstanceConfig value) {
    return new Entry(value, clock.instant().plus(ttl));
  }

  private record Entry(InstanceConfig value, Instant expiresAt) {
    boolean isFresh(Instant now) {
      return now.isBefore(expiresAt);
    }
  }
}
