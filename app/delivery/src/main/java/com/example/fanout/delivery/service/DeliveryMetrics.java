/*
 * どこで: Delivery サービス層
 * 何を: チャネル別の配信結果、試行回数、DLQ 送信結果、不正ペイロードを記録する
 * なぜ: プロバイダ障害と DLQ 流入を Prometheus から観測するため
 */
package com.example.fanout.delivery.service;

import com.example.fanout.common.event.DeliveryChannel;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
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
public class DeliveryMetrics {

  private static final String METRIC_OUTCOME_TOTAL = "delivery.outcome.total";
  private static final String METRIC_ATTEMPTS = "delivery.attempts";
  private static final String METRIC_DLQ_PUBLISHED = "delivery.dlq.published.total";
  private static final String METRIC_DLQ_FAILURES = "delivery.dlq.failures.total";
  private static final String METRIC_INVALID_PAYLOADS = "delivery.payload.invalid.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, DistributionSummary> summaries = new ConcurrentHashMap<>();
  private final Counter invalidPayloads;

  public DeliveryMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.invalidPayloads =
        Counter.builder(METRIC_INVALID_PAYLOADS)
            .description("Ready records skipped because the payload could not be decoded")
            .register(meterRegistry);
  }

  public void recordOutcome(DeliveryChannel channel, DeliveryOutcome outcome) {
    String channelTag = tagOf(channel);
    String outcomeTag = outcome.name().toLowerCase(Locale.ROOT);
    counter(
            METRIC_OUTCOME_TOTAL,
            "Channel deliveries by outcome",
            Tags.of("channel", channelTag, "outcome", outcomeTag))
        .increment();
  }

  /** 成功/失敗を問わず、1 件の配信に要した送信試行回数。 */
  public void recordAttempts(DeliveryChannel channel, int attempts) {
    String channelTag = tagOf(channel);
    summaries
        .computeIfAbsent(
            channelTag,
            ignored ->
                DistributionSummary.builder(METRIC_ATTEMPTS)
                    .description("Send attempts per delivery")
                    .tags(Tags.of("channel", channelTag))
                    .register(meterRegistry))
        .record(attempts);
  }

  public void recordDeadLetterPublished(DeliveryChannel channel) {
    counter(
            METRIC_DLQ_PUBLISHED,
            "Envelopes written to the dead-letter topic",
            Tags.of("channel", tagOf(channel)))
        .increment();
  }

  public void recordDeadLetterFailure(DeliveryChannel channel) {
    counter(
            METRIC_DLQ_FAILURES,
            "Dead-letter publishes that failed",
            Tags.of("channel", tagOf(channel)))
        .increment();
  }

  public void recordInvalidPayload() {
    invalidPayloads.increment();
  }

  private Counter counter(String name, String description, Tags tags) {
    StringBuilder key = new StringBuilder(name);
    tags.forEach(tag -> key.append(':').append(tag.getValue()));
    return counters.computeIfAbsent(
        key.toString(),
        ignored ->
            Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }

  private static String tagOf(DeliveryChannel channel) {
    return channel.topicSuffix();
  }
}
