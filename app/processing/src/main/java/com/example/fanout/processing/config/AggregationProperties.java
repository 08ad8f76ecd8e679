/*
 * どこで: Processing アプリの設定バインド
 * 何を: 集約ウィンドウ長/TTL 余裕/スイープ間隔/即時フラッシュ件数を保持する
 * なぜ: 集約の遅延と通知量のトレードオフを運用で調整するため
 */
package com.example.fanout.processing.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "processing.aggregation")
@Validated
public record AggregationProperties(
    @NotNull Duration windowDuration,
    @NotNull Duration ttlBuffer,
    @NotNull Duration sweepInterval,
    @Positive int maxBatchSize,
    @Positive int scanCount,
    boolean sweepEnabled) {

  @AssertTrue(message = "processing.aggregation.window-duration must be at least 1s")
  public boolean isWindowDurationValid() {
    return windowDuration == null || windowDuration.compareTo(Duration.ofSeconds(1)) >= 0;
  }

  @AssertTrue(message = "processing.aggregation.sweep-interval must be positive")
  public boolean isSweepIntervalPositive() {
    return sweepInterval == null || (!sweepInterval.isZero() && !sweepInterval.isNegative());
  }

  @AssertTrue(message = "processing.aggregation.ttl-buffer must not be negative")
  public boolean isTtlBufferValid() {
    return ttlBuffer == null || !ttlBuffer.isNegative();
  }

  /** ウィンドウキーの TTL。最後の更新から window + buffer で消える。 */
  public Duration windowTtl() {
    return windowDuration.plus(ttlBuffer);
  }
}
