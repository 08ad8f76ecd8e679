/*
 * どこで: Processing アプリの設定バインド
 * 何を: ティアごとのトピック/グループ/パーティション/並列度と ready トピック、ポーリング設定を保持する
 * なぜ: ティア間の独立性と処理能力を環境ごとに調整し、起動時に妥当性を検証するため
 */
package com.example.fanout.processing.config;

import com.example.fanout.common.event.NotificationPriority;
import com.example.fanout.common.kafka.ConsumerSettings;
import com.example.fanout.common.kafka.TopicSpec;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "processing.kafka")
@Validated
public record ProcessingKafkaProperties(
    @NotBlank String bootstrapServers,
    @NotBlank String clientId,
    @NotBlank String autoOffsetReset,
    @Positive int maxPollRecords,
    @NotNull Duration sessionTimeout,
    @NotNull Duration heartbeatInterval,
    @NotNull Duration pollTimeout,
    @NotNull Duration transientBackoff,
    @NotNull Duration shutdownGrace,
    @NotNull Duration sendTimeout,
    @NotNull Duration adminTimeout,
    @Positive short replicationFactor,
    @NotEmpty Map<NotificationPriority, @Valid TierProperties> tiers,
    @NotNull @Valid ReadyTopicProperties ready) {

  @AssertTrue(message = "processing.kafka durations must be positive")
  public boolean isDurationsPositive() {
    return isPositiveDuration(sessionTimeout)
        && isPositiveDuration(heartbeatInterval)
        && isPositiveDuration(pollTimeout)
        && isPositiveDuration(shutdownGrace)
        && isPositiveDuration(sendTimeout)
        && isPositiveDuration(adminTimeout);
  }

  @AssertTrue(message = "processing.kafka.transient-backoff must not be negative")
  public boolean isTransientBackoffValid() {
    return transientBackoff == null || !transientBackoff.isNegative();
  }

  public ConsumerSettings toConsumerSettings() {
    return new ConsumerSettings(
        bootstrapServers,
        clientId,
        autoOffsetReset,
        maxPollRecords,
        sessionTimeout,
        heartbeatInterval,
        pollTimeout,
        transientBackoff,
        shutdownGrace);
  }

  private static boolean isPositiveDuration(Duration duration) {
    // null は @NotNull で検出する前提。
    return duration == null || (!duration.isZero() && !duration.isNegative());
  }

  /** 1 ティア分のトピックとコンシューマーグループ。 */
  public record TierProperties(
      boolean enabled,
      @NotBlank String topic,
      @NotBlank String groupId,
      @Positive int partitions,
      @Positive int concurrency,
      @NotNull Duration retention) {

    public TopicSpec toTopicSpec(short replicationFactor) {
      return new TopicSpec(topic, partitions, replicationFactor, retention);
    }
  }

  public record ReadyTopicProperties(
      @NotBlank String topic, @Positive int partitions, @NotNull Duration retention) {

    public TopicSpec toTopicSpec(short replicationFactor) {
      return new TopicSpec(topic, partitions, replicationFactor, retention);
    }
  }
}
