/*
 * どこで: Delivery アプリの設定バインド
 * 何を: ready トピックの購読設定と DLQ 送信/トピック作成のタイムアウトを保持する
 * なぜ: 再送待機を含む処理時間に合わせてポーリング設定を環境ごとに調整するため
 */
package com.example.fanout.delivery.config;

import com.example.fanout.common.kafka.ConsumerSettings;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "delivery.kafka")
@Validated
public record DeliveryKafkaProperties(
    @NotBlank String bootstrapServers,
    @NotBlank String clientId,
    @NotBlank String readyTopic,
    @NotBlank String autoOffsetReset,
    @Positive int maxPollRecords,
    @NotNull Duration sessionTimeout,
    @NotNull Duration heartbeatInterval,
    @NotNull Duration pollTimeout,
    @NotNull Duration transientBackoff,
    @NotNull Duration shutdownGrace,
    @NotNull Duration sendTimeout,
    @NotNull Duration adminTimeout,
    @Positive short replicationFactor) {

  @AssertTrue(message = "delivery.kafka durations must be positive")
  public boolean isDurationsPositive() {
    return isPositiveDuration(sessionTimeout)
        && isPositiveDuration(heartbeatInterval)
        && isPositiveDuration(pollTimeout)
        && isPositiveDuration(shutdownGrace)
        && isPositiveDuration(sendTimeout)
        && isPositiveDuration(adminTimeout);
  }

  @AssertTrue(message = "delivery.kafka.transient-backoff must not be negative")
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
}
