/*
 * どこで: Ingestion データアクセスの統合テスト
 * 何を: kafka_fallback_events の登録/取得/更新/集計を実 DB で検証する
 * なぜ: 再送対象の抽出条件と集計条件の回帰を防ぐため
 */
package com.example.fanout.ingestion.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.fanout.common.event.NotificationPriority;
import com.example.fanout.ingestion.AbstractPostgresContainerTest;
import com.example.fanout.ingestion.model.FallbackRecord;
import com.example.fanout.ingestion.model.FallbackStats;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;

@JdbcTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(FallbackEventRepository.class)
class FallbackEventRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant CREATED_AT = Instant.parse("2026-03-01T00:00:00Z");
  private static final int MAX_RETRIES = 5;

  @Autowired private FallbackEventRepository repository;

  @Test
  void insertIgnoresDuplicateEventIds() {
    FallbackRecord record = record("evt-dup", CREATED_AT);

    assertThat(repository.insert(record)).isEqualTo(1);
    assertThat(repository.insert(record)).isZero();

    FallbackRecord stored = repository.findById("evt-dup").orElseThrow();
    assertThat(stored.retryCount()).isZero();
    assertThat(stored.processed()).isFalse();
    assertThat(stored.lastError()).isEqualTo("Kafka connection error");
    assertThat(stored.priority()).isEqualTo(NotificationPriority.HIGH);
    assertThat(stored.eventData()).contains("\"targetId\"");
  }

  @Test
  void findUnprocessedOrdersByCreationAndSkipsExhaustedRecords() {
    repository.insert(record("evt-2", CREATED_AT.plusSeconds(2)));
    repository.insert(record("evt-1", CREATED_AT.plusSeconds(1)));
    repository.insert(record("evt-3", CREATED_AT.plusSeconds(3)));
    repository.markPermanentlyFailed("evt-3", MAX_RETRIES, "unreadable", CREATED_AT);

    List<FallbackRecord> unprocessed = repository.findUnprocessed(MAX_RETRIES, 10);

    assertThat(unprocessed).extracting(FallbackRecord::id).containsExactly("evt-1", "evt-2");
  }

  @Test
  void processedAndRetriedRecordsAreCountedSeparately() {
    repository.insert(record("evt-a", CREATED_AT));
    repository.insert(record("evt-b", CREATED_AT));
    repository.insert(record("evt-c", CREATED_AT));
    Instant later = CREATED_AT.plusSeconds(60);

    assertThat(repository.markProcessed("evt-a", later)).isEqualTo(1);
    for (int i = 0; i < MAX_RETRIES; i++) {
      repository.incrementRetryCount("evt-b", "timeout", later);
    }

    FallbackRecord processed = repository.findById("evt-a").orElseThrow();
    assertThat(processed.processed()).isTrue();
    assertThat(processed.processedAt()).isEqualTo(later);
    FallbackRecord retried = repository.findById("evt-b").orElseThrow();
    assertThat(retried.retryCount()).isEqualTo(MAX_RETRIES);
    assertThat(retried.lastRetryAt()).isEqualTo(later);
    assertThat(repository.stats(MAX_RETRIES)).isEqualTo(new FallbackStats(1, 1, 1));
  }

  private static FallbackRecord record(String id, Instant createdAt) {
    String json = "{\"id\":\"" + id + "\",\"type\":\"LIKE\",\"targetId\":\"user-1\"}";
    return FallbackRecord.pending(
        id,
        json,
        "high-priority-notifications",
        NotificationPriority.HIGH,
        "user-1",
        "Kafka connection error",
        createdAt);
  }
}
