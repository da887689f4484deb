/*
 * どこで: Notification ドメインモデル
 * 何を: instance_config テーブルのスナップショット(管理者一覧を含む)
 * なぜ: 管理 API の認可判定をインスタンス単位の設定で行うため
 */
package com.notifyhub.notification.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record InstanceConfig(String instanceName, List<UUID> admins, UUID etag, Instant updatedAt) {

  public InstanceConfig {
    admins = admins == null ? List.of() : List.copyOf(admins);
  }

  public boolean isAdmin(UUID userObjectId) {
    return userObjectId != null && admins.contains(userObjectId);
  }

  public InstanceConfig withAdmins(List<UUID> newAdmins) {
    return new InstanceConfig(instanceName, newAdmins, etag, updatedAt);
  }
}
