package com.example.fanout.processing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.fanout.processing.TestEvents;
import com.example.fanout.processing.model.AggregatedNotification;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;

@ExtendWith(MockitoExtension.class)
class AggregationSweepServiceTest {

  @Mock private AggregationService aggregationService;
  @Mock private NotificationProcessingService processingService;

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private AggregationSweepService sweepService;

  @BeforeEach
  void setUp() {
    sweepService =
        new AggregationSweepService(
            aggregationService, processingService, new ProcessingMetrics(meterRegistry));
  }

  @Test
  void emitFailureForOneWindowDoesNotStopTheSweep() {
    AggregatedNotification first = aggregate("agg:user-1:LIKE:post-1:10");
    AggregatedNotification second = aggregate("agg:user-2:LIKE:post-2:10");
    when(aggregationService.closedWindowKeys())
        .thenReturn(List.of(first.windowKey(), second.windowKey()));
    when(aggregationService.flush(first.windowKey())).thenReturn(Optional.of(first));
    when(aggregationService.flush(second.windowKey())).thenReturn(Optional.of(second));
    doThrow(new ReadyPublishException("ready down", null))
        .when(processingService)
        .emitAggregate(first);

    assertThat(sweepService.sweep()).isEqualTo(1);

    verify(processingService).emitAggregate(second);
    assertThat(
            meterRegistry
                .get("processing.aggregation.flushed.total")
                .tag("trigger", "sweep")
                .counter()
                .count())
        .isEqualTo(2.0);
  }

  @Test
  void alreadyFlushedWindowIsSkipped() {
    when(aggregationService.closedWindowKeys()).thenReturn(List.of("agg:user-1:LIKE:post-1:10"));
    when(aggregationService.flush("agg:user-1:LIKE:post-1:10")).thenReturn(Optional.empty());

    assertThat(sweepService.sweep()).isZero();

    verify(processingService, never()).emitAggregate(any());
  }

  @Test
  void listingFailureEndsSweepQuietly() {
    when(aggregationService.closedWindowKeys())
        .thenThrow(new RedisConnectionFailureException("redis down"));

    assertThat(sweepService.sweep()).isZero();

    assertThat(meterRegistry.get("processing.aggregation.store.errors.total").counter().count())
        .isEqualTo(1.0);
  }

  private static AggregatedNotification aggregate(String windowKey) {
    return new AggregatedNotification(
        windowKey,
        TestEvents.like("evt-1", "a"),
        List.of("a", "b"),
        List.of("Name a", "Name b"),
        List.of(),
        2,
        TestEvents.FIXED_NOW);
  }
}
