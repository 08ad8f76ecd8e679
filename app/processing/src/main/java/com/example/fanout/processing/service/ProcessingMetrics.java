/*
 * どこで: Processing サービス層
 * 何を: ティア別の処理結果、集約フラッシュ、ストア障害、ready 送信失敗、監査ログ欠落を記録する
 * なぜ: 集約の効き具合と fail-open の発生頻度を Prometheus から観測するため
 */
package com.example.fanout.processing.service;

import com.example.fanout.common.event.NotificationPriority;
import com.example.fanout.processing.model.ProcessingOutcome;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ProcessingMetrics {

  private static final String METRIC_EVENTS_TOTAL = "processing.events.total";
  private static final String METRIC_FLUSHED_TOTAL = "processing.aggregation.flushed.total";
  private static final String METRIC_STORE_ERRORS = "processing.aggregation.store.errors.total";
  private static final String METRIC_PREFERENCE_ERRORS = "processing.preference.errors.total";
  private static final String METRIC_EMIT_FAILURES = "processing.ready.emit.failures.total";
  private static final String METRIC_INVALID_PAYLOADS = "processing.payload.invalid.total";
  private static final String METRIC_AUDIT_DROPPED = "processing.audit.dropped.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter storeErrors;
  private final Counter preferenceErrors;
  private final Counter emitFailures;
  private final Counter invalidPayloads;
  private final Counter auditDropped;

  public ProcessingMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.storeErrors =
        Counter.builder(METRIC_STORE_ERRORS)
            .description("Aggregation store errors that fell back to immediate send")
            .register(meterRegistry);
    this.preferenceErrors =
        Counter.builder(METRIC_PREFERENCE_ERRORS)
            .description("Preference lookups that failed open")
            .register(meterRegistry);
    this.emitFailures =
        Counter.builder(METRIC_EMIT_FAILURES)
            .description("Ready stream publish failures")
            .register(meterRegistry);
    this.invalidPayloads =
        Counter.builder(METRIC_INVALID_PAYLOADS)
            .description("Records skipped because the payload could not be decoded")
            .register(meterRegistry);
    this.auditDropped =
        Counter.builder(METRIC_AUDIT_DROPPED)
            .description("Audit log entries dropped by back-off, queue overflow or write errors")
            .register(meterRegistry);
  }

  public void recordOutcome(NotificationPriority tier, ProcessingOutcome outcome) {
    String tierTag = tier.name().toLowerCase(Locale.ROOT);
    String outcomeTag = outcome.name().toLowerCase(Locale.ROOT);
    counters
        .computeIfAbsent(
            METRIC_EVENTS_TOTAL + ":" + tierTag + ":" + outcomeTag,
            ignored ->
                Counter.builder(METRIC_EVENTS_TOTAL)
                    .description("Processed notification events by tier and outcome")
                    .tags(Tags.of("tier", tierTag, "outcome", outcomeTag))
                    .register(meterRegistry))
        .increment();
  }

  public void recordFlush(String trigger) {
    counters
        .computeIfAbsent(
            METRIC_FLUSHED_TOTAL + ":" + trigger,
            ignored ->
                Counter.builder(METRIC_FLUSHED_TOTAL)
                    .description("Aggregation windows flushed by trigger")
                    .tags(Tags.of("trigger", trigger))
                    .register(meterRegistry))
        .increment();
  }

  public void recordStoreError() {
    storeErrors.increment();
  }

  public void recordPreferenceError() {
    preferenceErrors.increment();
  }

  public void recordEmitFailure() {
    emitFailures.increment();
  }

  public void recordInvalidPayload() {
    invalidPayloads.increment();
  }

  public void recordAuditDropped() {
    auditDropped.increment();
  }
}
