/*
 * どこで: Notification アプリ設定バインド
 * 何を: インスタンス設定(名前/初期管理者/キャッシュ有効期間)を保持する
 * なぜ: 環境ごとにインスタンス名と初期管理者を切り替えられるようにするため
 */
package com.notifyhub.notification.config;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.instance")
public record InstanceConfigProperties(
    String name, boolean bootstrapEnabled, List<UUID> bootstrapAdmins, Duration cacheTtl) {

  private static final String DEFAULT_NAME = "default";
  private static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(1);

  public InstanceConfigProperties {
    name = name == null || name.isBlank() ? DEFAULT_NAME : name;
    bootstrapAdmins = bootstrapAdmins == null ? List.of() : List.copyOf(bootstrapAdmins);
    if (cacheTtl == null || cacheTtl.isNegative()) {
      cacheTtl = DEFAULT_CACHE_TTL;
    }
  }
}
