/*
 * どこで: Notification アプリのスモークテスト
 * 何を: Spring コンテキストの起動と初期インスタンス設定の登録を確認する
 * なぜ: 主要な構成が破壊されていないことを担保するため
 */
package com.notifyhub.notification;

import static org.assertj.core.api.Assertions.assertThat;

import com.notifyhub.notification.service.InstanceConfigOperations;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private InstanceConfigOperations instanceConfigOperations;

  @Test
  void contextLoadsAndBootstrapsInstanceAdmins() {
    assertThat(instanceConfigOperations.fetch())
        .hasValueSatisfying(
            config ->
                assertThat(config.isAdmin(UUID.fromString("00000000-0000-0000-0000-0000000000a1")))
                    .isTrue());
  }
}
