/*
 * どこで: Processing データアクセス
 * 何を: notification_preferences からユーザーの通知設定を取得する
 * なぜ: 配信前にミュート/DND を判定するため
 */
package com.example.fanout.processing.repository;

import com.example.fanout.processing.model.NotificationPreference;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalTime;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class PreferenceRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public PreferenceRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    // SpotBugs の EI_EXPOSE_REP2 対応: 外部参照を直接保持せず、ラッパを作り直す
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  public Optional<NotificationPreference> findByUserId(String userId) {
    final String sql =
        """
        SELECT user_id, push_enabled, marketing, activity, social, dnd_enabled,
               dnd_start_time, dnd_end_time
        FROM notification_preferences
        WHERE user_id = :userId
        """;
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("userId", userId), this::mapRow)
        .stream()
        .findFirst();
  }

  private NotificationPreference mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationPreference(
        rs.getString("user_id"),
        rs.getBoolean("push_enabled"),
        rs.getBoolean("marketing"),
        rs.getBoolean("activity"),
        rs.getBoolean("social"),
        rs.getBoolean("dnd_enabled"),
        parseTime(rs.getString("dnd_start_time")),
        parseTime(rs.getString("dnd_end_time")));
  }

  // HH:mm 形式。不正値は呼び出し側で fail-open になる
  private static LocalTime parseTime(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return LocalTime.parse(value.trim());
  }
}
