/*
 * どこで: Box データアクセス(PostgreSQL 実装)
 * 何を: Box 集約を JSONB 文書として保存し、version 列で条件付き更新を行う
 * なぜ: 集約単位の compare-and-swap を単一 UPDATE で原子的に実現するため
 */
package com.example.lockbox.box.repository;

import static com.example.lockbox.common.JdbcTimestampUtils.toInstant;
import static com.example.lockbox.common.JdbcTimestampUtils.toTimestamp;

import com.example.lockbox.box.model.BoxRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "box.store.type", havingValue = "jdbc", matchIfMissing = true)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "JdbcTemplate/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class JdbcBoxRepository implements BoxRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public JdbcBoxRepository(
      NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public Optional<BoxRecord> findById(String id) {
    final String sql =
        """
        SELECT id, version, document, updated_at
        FROM boxes
        WHERE id = :id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public List<BoxRecord> findByOwnerId(String ownerId) {
    final String sql =
        """
        SELECT id, version, document, updated_at
        FROM boxes
        WHERE owner_id = :ownerId
        ORDER BY updated_at DESC
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ownerId", ownerId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public List<BoxRecord> findByGuardianId(String userId) {
    // guardians 配列の JSONB 包含検索で GIN インデックスを使う
    final String sql =
        """
        SELECT id, version, document, updated_at
        FROM boxes
        WHERE document -> 'guardians' @> CAST(:guardianFilter AS jsonb)
        ORDER BY updated_at DESC
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("guardianFilter", writeJson(List.of(Map.of("id", userId))));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public BoxRecord create(BoxRecord box) {
    final BoxRecord created = box.withCommit(0L, box.updatedAt());
    final String sql =
        """
        INSERT INTO boxes (id, owner_id, version, document, created_at, updated_at)
        VALUES (:id, :ownerId, 0, CAST(:document AS jsonb), :createdAt, :updatedAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", created.id())
            .addValue("ownerId", created.ownerId())
            .addValue("document", writeJson(created))
            .addValue("createdAt", toTimestamp(created.createdAt()))
            .addValue("updatedAt", toTimestamp(created.updatedAt()));
    try {
      jdbcTemplate.update(sql, params);
    } catch (DuplicateKeyException ex) {
      throw new BoxStoreException("box already exists: " + box.id(), ex);
    }
    return created;
  }

  @Override
  public BoxRecord update(BoxRecord box) {
    final Instant now = Instant.now(clock);
    final BoxRecord committed = box.withCommit(box.version() + 1, now);
    // 読み取り時の version と一致する行だけを更新し、不一致なら 0 件になる
    final String sql =
        """
        UPDATE boxes
        SET document = CAST(:document AS jsonb),
            version = version + 1,
            updated_at = :updatedAt
        WHERE id = :id
          AND version = :expectedVersion
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", box.id())
            .addValue("expectedVersion", box.version())
            .addValue("document", writeJson(committed))
            .addValue("updatedAt", toTimestamp(now));
    final int updated = jdbcTemplate.update(sql, params);
    if (updated == 0) {
      if (!exists(box.id())) {
        throw new BoxNotFoundException(box.id());
      }
      throw new VersionConflictException(box.id(), box.version());
    }
    return committed;
  }

  @Override
  public void delete(String id) {
    final int deleted =
        jdbcTemplate.update(
            "DELETE FROM boxes WHERE id = :id", new MapSqlParameterSource().addValue("id", id));
    if (deleted == 0) {
      throw new BoxNotFoundException(id);
    }
  }

  private boolean exists(String id) {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT count(*) FROM boxes WHERE id = :id",
            new MapSqlParameterSource().addValue("id", id),
            Integer.class);
    return count != null && count > 0;
  }

  private BoxRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String document = rs.getString("document");
    try {
      final BoxRecord stored = objectMapper.readValue(document, BoxRecord.class);
      // version/updated_at は列の値を正とする
      return stored.withCommit(rs.getLong("version"), toInstant(rs.getTimestamp("updated_at")));
    } catch (JsonProcessingException ex) {
      throw new BoxStoreException("failed to parse box document: " + rs.getString("id"), ex);
    }
  }

  private String writeJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new BoxStoreException("failed to serialize box document", ex);
    }
  }
}
