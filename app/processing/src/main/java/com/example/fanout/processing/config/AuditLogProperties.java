/*
 * どこで: Processing アプリの設定バインド
 * 何を: 監査ログの保持期間と失敗後の抑止時間、非同期キュー容量を保持する
 * なぜ: 監査ログ障害がパイプラインを詰まらせないよう上限を外部化するため
 */
package com.example.fanout.processing.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "processing.audit")
@Validated
public record AuditLogProperties(
    boolean enabled,
    @NotNull Duration retention,
    @NotNull Duration suppressAfterFailure,
    @Positive int queueCapacity,
    @NotNull Duration shutdownGrace,
    @NotNull Duration purgeInterval) {

  @AssertTrue(message = "processing.audit durations must be positive")
  public boolean isDurationsPositive() {
    return isPositive(retention) && isPositive(shutdownGrace) && isPositive(purgeInterval);
  }

  @AssertTrue(message = "processing.audit.suppress-after-failure must not be negative")
  public boolean isSuppressAfterFailureValid() {
    return suppressAfterFailure == null || !suppressAfterFailure.isNegative();
  }

  private static boolean isPositive(Duration duration) {
    return duration == null || (!duration.isZero() && !duration.isNegative());
  }
}
