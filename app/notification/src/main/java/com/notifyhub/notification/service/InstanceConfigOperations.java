/*
 * どこで: Notification サービス層
 * 何を: インスタンス設定の取得(キャッシュ経由)と保存を行う
 * なぜ: 管理者判定の読み取りを安くしつつ、更新は etag 比較で衝突を検出するため
 */
package com.notifyhub.notification.service;

import com.notifyhub.notification.api.InstanceConfigConflictException;
import com.notifyhub.notification.config.InstanceConfigProperties;
import com.notifyhub.notification.model.InstanceConfig;
import com.notifyhub.notification.repository.InstanceConfigRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class InstanceConfigOperations {

  private static final Logger logger = LoggerFactory.getLogger(InstanceConfigOperations.class);

  private final InstanceConfigRepository instanceConfigRepository;
  private final InstanceConfigProperties properties;
  private final Clock clock;
  private final InstanceConfigCache cache;

  public InstanceConfigOperations(
      InstanceConfigRepository instanceConfigRepository,
      InstanceConfigProperties properties,
      Clock clock) {
    this.instanceConfigRepository = instanceConfigRepository;
    this.properties = properties;
    this.clock = clock;
    this.cache = new InstanceConfigCache(clock, properties.cacheTtl());
  }

  public Optional<InstanceConfig> fetch() {
    return cache.get(() -> instanceConfigRepository.findByName(properties.name()));
  }

  /**
   * 役割: インスタンス設定を保存する。
   *
   * <p>動作:
   *
   * <ul>
   *   <li>isNew: 未登録の場合だけ登録する。
   *   <li>requireEtag かつ etag あり: 渡された etag と一致する場合だけ更新する。
   *   <li>それ以外: 無条件に置き換える。
   * </ul>
   *
   * <p>成功時は新しい etag を採番しキャッシュを更新する。失敗時は false を返す。
   */
  public boolean save(InstanceConfig config, boolean isNew, boolean requireEtag) {
    final InstanceConfig next =
        new InstanceConfig(properties.name(), config.admins(), UUID.randomUUID(), Instant.now(clock));
    final int affected;
    if (isNew) {
      affected = instanceConfigRepository.insert(next);
    } else if (requireEtag && config.etag() != null) {
      affected = instanceConfigRepository.updateIfEtagMatches(next, config.etag());
    } else {
      affected = instanceConfigRepository.upsert(next);
    }
    if (affected == 0) {
      logger.warn(
          "instance config save rejected instance={} isNew={} requireEtag={}",
          properties.name(),
          isNew,
          requireEtag);
      return false;
    }
    cache.put(next);
    logger.info(
        "instance config saved instance={} admins={} etag={}",
        next.instanceName(),
        next.admins().size(),
        next.etag());
    return true;
  }

  /** 管理者一覧を置き換える。etag が一致しなければ {@link InstanceConfigConflictException}。 */
  public InstanceConfig replaceAdmins(List<UUID> admins, UUID expectedEtag) {
    if (admins == null || admins.isEmpty()) {
      throw new IllegalArgumentException("admins must not be empty");
    }
    final InstanceConfig current =
        fetch().orElseThrow(() -> new InstanceConfigConflictException("instance config missing"));
    final InstanceConfig requested =
        new InstanceConfig(current.instanceName(), admins, expectedEtag, current.updatedAt());
    if (!save(requested, false, true)) {
      cache.invalidate();
      throw new InstanceConfigConflictException("instance config etag mismatch");
    }
    return fetch().orElseThrow(() -> new IllegalStateException("instance config vanished"));
  }
}
