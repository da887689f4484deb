/*
 * どこで: Notification サービス層
 * 何を: 通知設定の登録と参照を行う
 * なぜ: 移行対象となる設定を API から登録/確認できるようにするため
 */
package com.notifyhub.notification.service;

import com.notifyhub.notification.api.NotificationConfigNotFoundException;
import com.notifyhub.notification.model.NotificationConfig;
import com.notifyhub.notification.model.NotificationConfigRecord;
import com.notifyhub.notification.repository.NotificationConfigRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationConfigService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationConfigService.class);

  private final NotificationConfigRepository notificationConfigRepository;
  private final Clock clock;

  public NotificationConfigRecord create(String container, NotificationConfig config) {
    final NotificationConfigRecord record =
        new NotificationConfigRecord(
            UUID.randomUUID(), container, config, UUID.randomUUID(), Instant.now(clock));
    notificationConfigRepository.insert(record);
    logger.info(
        "notification config created id={} container={} type={}",
        record.notificationId(),
        container,
        config.configType());
    return record;
  }

  public NotificationConfigRecord get(UUID notificationId) {
    return notificationConfigRepository
        .findById(notificationId)
        .orElseThrow(() -> new NotificationConfigNotFoundException(notificationId));
  }

  public List<NotificationConfigRecord> listByContainer(String container) {
    return notificationConfigRepository.findByContainer(container);
  }
}
