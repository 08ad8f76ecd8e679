package com.example.fanout.processing.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.common.event.NotificationType;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class AggregationKeyTest {

  @Test
  void windowKeyIncludesEntityWhenPresent() {
    AggregationKey key = new AggregationKey("user-1", NotificationType.LIKE, "post-9", 42L);

    assertThat(key.windowKey()).isEqualTo("agg:user-1:LIKE:post-9:42");
    assertThat(key.metaKey()).isEqualTo("agg:user-1:LIKE:post-9:42:meta");
  }

  @Test
  void windowKeyOmitsMissingEntity() {
    NotificationEvent follow =
        NotificationEvent.builder()
            .id("evt-1")
            .type(NotificationType.FOLLOW)
            .actorId("actor-1")
            .targetId("user-1")
            .build();

    assertThat(AggregationKey.of(follow, 7L).windowKey()).isEqualTo("agg:user-1:FOLLOW:7");
  }

  @Test
  void windowIdIsFloorOfEpochMillisOverDuration() {
    Duration window = Duration.ofSeconds(120);
    Instant start = Instant.parse("2026-03-01T00:00:00Z");

    long id = AggregationKey.windowIdAt(start, window);

    assertThat(AggregationKey.windowIdAt(start.plusSeconds(119), window)).isEqualTo(id);
    assertThat(AggregationKey.windowIdAt(start.plusSeconds(120), window)).isEqualTo(id + 1);
    assertThat(id).isEqualTo(start.toEpochMilli() / window.toMillis());
  }

  @Test
  void windowPatternDoesNotMatchMetaKeys() {
    String pattern = AggregationKey.windowPattern(42L);

    assertThat(pattern).isEqualTo("agg:*:42");
    assertThat("agg:user-1:LIKE:post-9:42:meta").doesNotEndWith(":42");
  }
}
