/*
 * どこで: Processing データアクセス
 * 何を: notification_audit_log への追記と期限切れ行の削除を担う
 * なぜ: 配信判断の履歴を一定期間だけ残すため
 */
package com.example.fanout.processing.repository;

import static com.example.fanout.common.jdbc.JdbcTimestampUtils.toTimestamp;

import com.example.fanout.processing.model.AuditLogEntry;
import java.time.Instant;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class AuditLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public AuditLogRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    // SpotBugs の EI_EXPOSE_REP2 対応: 外部参照を直接保持せず、ラッパを作り直す
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  public int insert(AuditLogEntry entry) {
    final String sql =
        """
        INSERT INTO notification_audit_log (
          id,
          event_id,
          user_id,
          type,
          status,
          logged_at,
          expires_at
        ) VALUES (
          :id,
          :eventId,
          :userId,
          :type,
          :status,
          :loggedAt,
          :expiresAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", entry.id())
            .addValue("eventId", entry.eventId())
            .addValue("userId", entry.userId())
            .addValue("type", entry.type().name())
            .addValue("status", entry.status().name())
            .addValue("loggedAt", toTimestamp(entry.loggedAt()))
            .addValue("expiresAt", toTimestamp(entry.expiresAt()));
    return jdbcTemplate.update(sql, params);
  }

  public int deleteExpired(Instant now) {
    final String sql =
        """
        DELETE FROM notification_audit_log
        WHERE expires_at <= :now
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("now", toTimestamp(now)));
  }

  public int countByEventId(String eventId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_audit_log
        WHERE event_id = :eventId
        """;
    Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("eventId", eventId), Integer.class);
    return count == null ? 0 : count;
  }
}
