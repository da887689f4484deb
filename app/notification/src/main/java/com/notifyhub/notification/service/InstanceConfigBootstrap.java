/*
 * どこで: Notification サービス層
 * 何を: 起動時にインスタンス設定が無ければ初期管理者で登録する
 * なぜ: 新しい環境でも管理 API を使える管理者を 1 人以上用意するため
 */
package com.notifyhub.notification.service;

import com.notifyhub.notification.config.InstanceConfigProperties;
import com.notifyhub.notification.model.InstanceConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    prefix = "notification.instance",
    name = "bootstrap-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class InstanceConfigBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(InstanceConfigBootstrap.class);

  private final InstanceConfigOperations instanceConfigOperations;
  private final InstanceConfigProperties properties;

  @PostConstruct
  public void ensureInstanceConfig() {
    if (instanceConfigOperations.fetch().isPresent()) {
      return;
    }
    if (properties.bootstrapAdmins().isEmpty()) {
      logger.warn(
          "instance config missing and no bootstrap admins configured instance={}",
          properties.name());
      return;
    }
    final InstanceConfig initial =
        new InstanceConfig(properties.name(), properties.bootstrapAdmins(), null, null);
    final boolean created = instanceConfigOperations.save(initial, true, false);
    logger.info(
        "instance config bootstrap instance={} created={} admins={}",
        properties.name(),
        created,
        properties.bootstrapAdmins().size());
  }
}
