/*
 * どこで: Notification データアクセス
 * 何を: instance_config テーブルの登録/取得/更新を担う
 * なぜ: 管理者一覧をインスタンス単位で保存し、etag による比較更新を可能にするため
 */
package com.notifyhub.notification.repository;

import static com.notifyhub.common.JdbcTimestampUtils.toInstant;
import static com.notifyhub.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notifyhub.notification.model.InstanceConfig;
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
public class InstanceConfigRepository {

  private static final TypeReference<List<UUID>> ADMIN_LIST = new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public Optional<InstanceConfig> findByName(String instanceName) {
    final String sql =
        """
        SELECT instance_name, admins_json::text AS admins_json_text, etag, updated_at
        FROM instance_config
        WHERE instance_name = :instanceName
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("instanceName", instanceName);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int insert(InstanceConfig config) {
    final String sql =
        """
        INSERT INTO instance_config (instance_name, admins_json, etag, updated_at)
        VALUES (:instanceName, CAST(:adminsJson AS jsonb), :etag, :updatedAt)
        ON CONFLICT (instance_name) DO NOTHING
        """;
    return jdbcTemplate.update(sql, params(config));
  }

  public int updateIfEtagMatches(InstanceConfig config, UUID expectedEtag) {
    final String sql =
        """
        UPDATE instance_config
        SET admins_json = CAST(:adminsJson AS jsonb),
            etag = :etag,
            updated_at = :updatedAt
        WHERE instance_name = :instanceName
          AND etag = :expectedEtag
        """;
    return jdbcTemplate.update(sql, params(config).addValue("expectedEtag", expectedEtag));
  }

  public int upsert(InstanceConfig config) {
    final String sql =
        """
        INSERT INTO instance_config (instance_name, admins_json, etag, updated_at)
        VALUES (:instanceName, CAST(:adminsJson AS jsonb), :etag, :updatedAt)
        ON CONFLICT (instance_name) DO UPDATE
        SET admins_json = EXCLUDED.admins_json,
            etag = EXCLUDED.etag,
            updated_at = EXCLUDED.updated_at
        """;
    return jdbcTemplate.update(sql, params(config));
  }

  private MapSqlParameterSource params(InstanceConfig config) {
    return new MapSqlParameterSource()
        .addValue("instanceName", config.instanceName())
        .addValue("adminsJson", writeAdmins(config.admins()))
        .addValue("etag", config.etag())
        .addValue("updatedAt", toTimestamp(config.updatedAt()));
  }

  private String writeAdmins(List<UUID> admins) {
    try {
      return objectMapper.writeValueAsString(admins);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize instance admins", ex);
    }
  }

  private List<UUID> readAdmins(String json) {
    try {
      return objectMapper.readValue(json, ADMIN_LIST);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to deserialize instance admins", ex);
    }
  }

  private InstanceConfig mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new InstanceConfig(
        rs.getString("instance_name"),
        readAdmins(rs.getString("admins_json_text")),
        UUID.fromString(rs.getString("etag")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
