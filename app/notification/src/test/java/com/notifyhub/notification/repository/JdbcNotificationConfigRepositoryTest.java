/*
 * どこで: 通知設定リポジトリの統合テスト
 * 何を: jsonb 保存と etag による比較更新を Postgres で検証する
 * なぜ: 競合と消失を区別でき、古い etag で上書きしないことを DB 上で保証するため
 */
package com.notifyhub.notification.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.notifyhub.notification.AbstractPostgresContainerTest;
import com.notifyhub.notification.NotificationConfigFixtures;
import com.notifyhub.notification.model.NotificationConfigRecord;
import java.sql.Timestamp;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class JdbcNotificationConfigRepositoryTest extends AbstractPostgresContainerTest {

  @Autowired private NotificationConfigRepository repository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM notification_configs", new MapSqlParameterSource());
  }

  @Test
  void storesAndReadsEveryConfigType() {
    final NotificationConfigRecord ado =
        NotificationConfigFixtures.record(NotificationConfigFixtures.legacyAdo());
    final NotificationConfigRecord github =
        NotificationConfigFixtures.record(NotificationConfigFixtures.legacyGithubIssues());
    final NotificationConfigRecord teams =
        NotificationConfigFixtures.record(NotificationConfigFixtures.teams());
    repository.insert(ado);
    repository.insert(github);
    repository.insert(teams);

    assertThat(repository.findById(ado.notificationId())).contains(ado);
    assertThat(repository.findById(github.notificationId())).contains(github);
    assertThat(repository.findById(teams.notificationId())).contains(teams);
    assertThat(repository.findAll()).hasSize(3);
    assertThat(repository.findByContainer("container-a")).hasSize(3);
    assertThat(repository.findByContainer("other")).isEmpty();
  }

  @Test
  void findAllReturnsUndecodableRowAlongsideGoodOnes() {
    final NotificationConfigRecord ado =
        NotificationConfigFixtures.record(NotificationConfigFixtures.legacyAdo());
    repository.insert(ado);
    final UUID corrupt = UUID.randomUUID();
    jdbcTemplate.update(
        """
        INSERT INTO notification_configs (notification_id, container, config_json, etag, updated_at)
        VALUES (:notificationId, 'container-a', CAST(:configJson AS jsonb), :etag, :updatedAt)
        """,
        new MapSqlParameterSource()
            .addValue("notificationId", corrupt)
            .addValue("configJson", "{\"notification_type\":\"slack\",\"channel\":\"#alerts\"}")
            .addValue("etag", UUID.randomUUID())
            .addValue(
                "updatedAt",
                Timestamp.from(NotificationConfigFixtures.BASE_TIME.plus(Duration.ofMinutes(1)))));

    final List<NotificationConfigRow> rows = repository.findAll();

    assertThat(rows).hasSize(2);
    assertThat(rows.get(0)).isEqualTo(NotificationConfigRow.decoded(ado));
    assertThat(rows.get(1).notificationId()).isEqualTo(corrupt);
    assertThat(rows.get(1).isDecoded()).isFalse();
    assertThat(rows.get(1).decodeError()).startsWith("failed to deserialize notification config");
  }

  @Test
  void updateSucceedsOnlyWithCurrentEtag() {
    final NotificationConfigRecord record =
        NotificationConfigFixtures.record(NotificationConfigFixtures.legacyAdo());
    repository.insert(record);
    final NotificationConfigRecord next =
        record.withConfig(
            NotificationConfigFixtures.adoWithProject(NotificationConfigFixtures.MIGRATED_PROJECT),
            UUID.randomUUID(),
            record.updatedAt().plus(Duration.ofMinutes(1)));

    assertThat(repository.updateIfVersionMatches(next, record.etag()))
        .isEqualTo(NotificationConfigUpdateResult.UPDATED);
    assertThat(repository.findById(record.notificationId())).contains(next);

    final NotificationConfigRecord stale =
        record.withConfig(record.config(), UUID.randomUUID(), record.updatedAt());
    assertThat(repository.updateIfVersionMatches(stale, record.etag()))
        .isEqualTo(NotificationConfigUpdateResult.VERSION_CONFLICT);
    assertThat(repository.findById(record.notificationId())).contains(next);
  }

  @Test
  void updateOfMissingRecordIsNotFound() {
    final NotificationConfigRecord record =
        NotificationConfigFixtures.record(NotificationConfigFixtures.teams());

    assertThat(repository.updateIfVersionMatches(record, record.etag()))
        .isEqualTo(NotificationConfigUpdateResult.NOT_FOUND);
  }
}
