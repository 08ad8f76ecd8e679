/*
 * どこで: Ingestion サービス層
 * 何を: 送信経路 (kafka/fallback/failed)、回収件数、フォールバック滞留、ブローカー健全性を記録する
 * なぜ: ブローカー障害時にどれだけ DB へ退避されているかを Prometheus から観測するため
 */
package com.example.fanout.ingestion.service;

import com.example.fanout.ingestion.model.FallbackStats;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class IngestionMetrics {

  private static final String METRIC_PUBLISH_TOTAL = "ingestion.publish.total";
  private static final String METRIC_RECOVERED_TOTAL = "ingestion.fallback.recovered.total";
  private static final String METRIC_FALLBACK_PENDING = "ingestion.fallback.pending";
  private static final String METRIC_FALLBACK_FAILED = "ingestion.fallback.failed";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> publishCounters = new ConcurrentHashMap<>();
  private final Counter recoveredCounter;
  private final AtomicLong fallbackPending = new AtomicLong(0);
  private final AtomicLong fallbackFailed = new AtomicLong(0);

  public IngestionMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.recoveredCounter =
        Counter.builder(METRIC_RECOVERED_TOTAL)
            .description("Fallback records republished to Kafka")
            .register(meterRegistry);
    Gauge.builder(METRIC_FALLBACK_PENDING, fallbackPending, AtomicLong::get)
        .description("Fallback records waiting for redelivery")
        .register(meterRegistry);
    Gauge.builder(METRIC_FALLBACK_FAILED, fallbackFailed, AtomicLong::get)
        .description("Fallback records that exhausted redelivery attempts")
        .register(meterRegistry);
  }

  public void recordPublish(String route) {
    publishCounters
        .computeIfAbsent(
            route,
            ignored ->
                Counter.builder(METRIC_PUBLISH_TOTAL)
                    .description("Notification ingest outcomes by route")
                    .tags(Tags.of("route", route))
                    .register(meterRegistry))
        .increment();
  }

  public void recordRecovered(int count) {
    if (count > 0) {
      recoveredCounter.increment(count);
    }
  }

  public void updateFallbackStats(FallbackStats stats) {
    fallbackPending.set(Math.max(stats.pending(), 0));
    fallbackFailed.set(Math.max(stats.failed(), 0));
  }
}
