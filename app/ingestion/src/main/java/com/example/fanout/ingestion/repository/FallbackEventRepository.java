/*
 * どこで: Ingestion データアクセス
 * 何を: kafka_fallback_events の登録/未処理取得/状態更新/集計を担う
 * なぜ: ブローカー停止中に受け付けたイベントを失わず、復旧後に再送するため
 */
package com.example.fanout.ingestion.repository;

import static com.example.fanout.common.jdbc.JdbcTimestampUtils.toInstant;
import static com.example.fanout.common.jdbc.JdbcTimestampUtils.toTimestamp;

import com.example.fanout.common.event.NotificationPriority;
import com.example.fanout.ingestion.model.FallbackRecord;
import com.example.fanout.ingestion.model.FallbackStats;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class FallbackEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public FallbackEventRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    // SpotBugs の EI_EXPOSE_REP2 対応: 外部参照を直接保持せず、ラッパを作り直す
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  /** 同一イベント ID の二重登録は無視する。 */
  public int insert(FallbackRecord record) {
    final String sql =
        """
        INSERT INTO kafka_fallback_events (
          id,
          event_data,
          topic,
          priority,
          target_id,
          processed,
          retry_count,
          last_error,
          created_at
        ) VALUES (
          :id,
          :eventData::jsonb,
          :topic,
          :priority,
          :targetId,
          FALSE,
          0,
          :lastError,
          :createdAt
        )
        ON CONFLICT (id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("eventData", record.eventData())
            .addValue("topic", record.topic())
            .addValue("priority", record.priority().name())
            .addValue("targetId", record.targetId())
            .addValue("lastError", record.lastError())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    return jdbcTemplate.update(sql, params);
  }

  public List<FallbackRecord> findUnprocessed(int maxRetries, int limit) {
    final String sql =
        """
        SELECT id, event_data::text AS event_data_text, topic, priority, target_id, processed,
               processed_at, retry_count, last_retry_at, last_error, created_at
        FROM kafka_fallback_events
        WHERE processed = FALSE
          AND retry_count < :maxRetries
        ORDER BY created_at
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("maxRetries", maxRetries).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<FallbackRecord> findById(String id) {
    final String sql =
        """
        SELECT id, event_data::text AS event_data_text, topic, priority, target_id, processed,
               processed_at, retry_count, last_retry_at, last_error, created_at
        FROM kafka_fallback_events
        WHERE id = :id
        """;
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("id", id), this::mapRow)
        .stream()
        .findFirst();
  }

  public int markProcessed(String id, Instant processedAt) {
    final String sql =
        """
        UPDATE kafka_fallback_events
        SET processed = TRUE,
            processed_at = :processedAt
        WHERE id = :id
          AND processed = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("processedAt", toTimestamp(processedAt));
    return jdbcTemplate.update(sql, params);
  }

  public int incrementRetryCount(String id, String lastError, Instant retriedAt) {
    final String sql =
        """
        UPDATE kafka_fallback_events
        SET retry_count = retry_count + 1,
            last_error = :lastError,
            last_retry_at = :retriedAt
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("lastError", lastError)
            .addValue("retriedAt", toTimestamp(retriedAt));
    return jdbcTemplate.update(sql, params);
  }

  /** 再送しても回復しないレコードを上限回数に揃え、回収対象から外す。 */
  public int markPermanentlyFailed(String id, int maxRetries, String lastError, Instant failedAt) {
    final String sql =
        """
        UPDATE kafka_fallback_events
        SET retry_count = GREATEST(retry_count, :maxRetries),
            last_error = :lastError,
            last_retry_at = :failedAt
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("maxRetries", maxRetries)
            .addValue("lastError", lastError)
            .addValue("failedAt", toTimestamp(failedAt));
    return jdbcTemplate.update(sql, params);
  }

  public FallbackStats stats(int maxRetries) {
    final String sql =
        """
        SELECT
          COUNT(*) FILTER (WHERE processed = FALSE AND retry_count < :maxRetries) AS pending,
          COUNT(*) FILTER (WHERE processed = FALSE AND retry_count >= :maxRetries) AS failed,
          COUNT(*) FILTER (WHERE processed = TRUE) AS processed
        FROM kafka_fallback_events
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("maxRetries", maxRetries);
    final FallbackStats stats =
        jdbcTemplate.queryForObject(
            sql,
            params,
            (rs, rowNum) ->
                new FallbackStats(rs.getLong("pending"), rs.getLong("failed"), rs.getLong("processed")));
    return stats == null ? FallbackStats.empty() : stats;
  }

  private FallbackRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new FallbackRecord(
        rs.getString("id"),
        rs.getString("event_data_text"),
        rs.getString("topic"),
        NotificationPriority.valueOf(rs.getString("priority")),
        rs.getString("target_id"),
        rs.getBoolean("processed"),
        toInstant(rs.getTimestamp("processed_at")),
        rs.getInt("retry_count"),
        toInstant(rs.getTimestamp("last_retry_at")),
        rs.getString("last_error"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
