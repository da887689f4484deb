/*
 * どこで: Notification データアクセス
 * 何を: notification_configs テーブルの登録/取得/etag 付き更新を担う
 * なぜ: 版トークンの比較と書き換えを単一 SQL で行い、後勝ちの上書きを防ぐため
 */
package com.notifyhub.notification.repository;

import static com.notifyhub.common.JdbcTimestampUtils.toInstant;
import static com.notifyhub.common.JdbcTimestampUtils.toTimestamp;

import com.notifyhub.notification.model.NotificationConfigRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcNotificationConfigRepository implements NotificationConfigRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT notification_id, container, config_json::text AS config_json_text, etag, updated_at
      FROM notification_configs
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final NotificationConfigJsonCodec codec;

  @Override
  public void insert(NotificationConfigRecord record) {
    final String sql =
        """
        INSERT INTO notification_configs (notification_id, container, config_json, etag, updated_at)
        VALUES (:notificationId, :container, CAST(:configJson AS jsonb), :etag, :updatedAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("container", record.container())
            .addValue("configJson", codec.toJson(record.config()))
            .addValue("etag", record.etag())
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public List<NotificationConfigRow> findAll() {
    final String sql = SELECT_COLUMNS + "ORDER BY updated_at, notification_id";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapLoadedRow);
  }

  @Override
  public Optional<NotificationConfigRecord> findById(UUID notificationId) {
    final String sql = SELECT_COLUMNS + "WHERE notification_id = :notificationId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("notificationId", notificationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public List<NotificationConfigRecord> findByContainer(String container) {
    final String sql = SELECT_COLUMNS + "WHERE container = :container ORDER BY updated_at";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("container", container);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public NotificationConfigUpdateResult updateIfVersionMatches(
      NotificationConfigRecord record, UUID expectedEtag) {
    final String sql =
        """
        UPDATE notification_configs
        SET config_json = CAST(:configJson AS jsonb),
            etag = :etag,
            updated_at = :updatedAt
        WHERE notification_id = :notificationId
          AND etag = :expectedEtag
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("configJson", codec.toJson(record.config()))
            .addValue("etag", record.etag())
            .addValue("updatedAt", toTimestamp(record.updatedAt()))
            .addValue("notificationId", record.notificationId())
            .addValue("expectedEtag", expectedEtag);
    if (jdbcTemplate.update(sql, params) > 0) {
      return NotificationConfigUpdateResult.UPDATED;
    }
    // 0 件更新は etag 不一致か行の消失。どちらかを判別して返す
    return exists(record.notificationId())
        ? NotificationConfigUpdateResult.VERSION_CONFLICT
        : NotificationConfigUpdateResult.NOT_FOUND;
  }

  private boolean exists(UUID notificationId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_configs
        WHERE notification_id = :notificationId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("notificationId", notificationId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count != null && count > 0;
  }

  // 壊れた行はここで止めず、理由だけを持たせて返す
  private NotificationConfigRow mapLoadedRow(ResultSet rs, int rowNum) throws SQLException {
    try {
      return NotificationConfigRow.decoded(mapRow(rs, rowNum));
    } catch (NotificationConfigDecodeException ex) {
      return NotificationConfigRow.undecodable(
          UUID.fromString(rs.getString("notification_id")), ex.getMessage());
    }
  }

  private NotificationConfigRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationConfigRecord(
        UUID.fromString(rs.getString("notification_id")),
        rs.getString("container"),
        codec.fromJson(rs.getString("config_json_text")),
        UUID.fromString(rs.getString("etag")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
