package com.example.fanout.processing.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.fanout.common.event.NotificationType;
import com.example.fanout.processing.AbstractPostgresContainerTest;
import com.example.fanout.processing.model.AuditLogEntry;
import com.example.fanout.processing.model.AuditStatus;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;

@JdbcTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(AuditLogRepository.class)
class AuditLogRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant LOGGED_AT = Instant.parse("2026-03-01T00:00:00Z");

  @Autowired private AuditLogRepository repository;

  @Test
  void insertedEntriesArePurgedOnlyAfterExpiry() {
    repository.insert(entry("log-1", "evt-1", LOGGED_AT.plus(Duration.ofDays(30))));
    repository.insert(entry("log-2", "evt-1", LOGGED_AT.plus(Duration.ofDays(1))));

    assertThat(repository.countByEventId("evt-1")).isEqualTo(2);

    int deleted = repository.deleteExpired(LOGGED_AT.plus(Duration.ofDays(2)));

    assertThat(deleted).isEqualTo(1);
    assertThat(repository.countByEventId("evt-1")).isEqualTo(1);
  }

  private static AuditLogEntry entry(String id, String eventId, Instant expiresAt) {
    return new AuditLogEntry(
        id, eventId, "user-1", NotificationType.LIKE, AuditStatus.SENT, LOGGED_AT, expiresAt);
  }
}
