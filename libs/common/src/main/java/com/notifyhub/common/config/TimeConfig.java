/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: 更新時刻やキャッシュ期限を同一の時刻源で扱い、テストで固定できるようにするため
 */
package com.notifyhub.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
