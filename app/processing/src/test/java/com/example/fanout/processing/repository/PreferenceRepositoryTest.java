package com.example.fanout.processing.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.fanout.processing.AbstractPostgresContainerTest;
import com.example.fanout.processing.model.NotificationPreference;
import java.time.LocalTime;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

@JdbcTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(PreferenceRepository.class)
class PreferenceRepositoryTest extends AbstractPostgresContainerTest {

  @Autowired private PreferenceRepository repository;
  @Autowired private JdbcTemplate jdbcTemplate;

  @Test
  void readsFlagsAndDndWindow() {
    jdbcTemplate.update(
        """
        INSERT INTO notification_preferences (
          user_id, push_enabled, marketing, activity, social, dnd_enabled,
          dnd_start_time, dnd_end_time
        ) VALUES ('user-1', TRUE, FALSE, TRUE, TRUE, TRUE, '22:00', '07:30')
        """);

    NotificationPreference preference = repository.findByUserId("user-1").orElseThrow();

    assertThat(preference.pushEnabled()).isTrue();
    assertThat(preference.marketing()).isFalse();
    assertThat(preference.activity()).isTrue();
    assertThat(preference.hasDndWindow()).isTrue();
    assertThat(preference.dndStartTime()).isEqualTo(LocalTime.of(22, 0));
    assertThat(preference.dndEndTime()).isEqualTo(LocalTime.of(7, 30));
  }

  @Test
  void columnDefaultsApplyToSparseRows() {
    jdbcTemplate.update("INSERT INTO notification_preferences (user_id) VALUES ('user-2')");

    NotificationPreference preference = repository.findByUserId("user-2").orElseThrow();

    assertThat(preference.pushEnabled()).isTrue();
    assertThat(preference.marketing()).isFalse();
    assertThat(preference.activity()).isTrue();
    assertThat(preference.hasDndWindow()).isFalse();
  }

  @Test
  void unknownUserHasNoPreferences() {
    assertThat(repository.findByUserId("nobody")).isEmpty();
  }
}
