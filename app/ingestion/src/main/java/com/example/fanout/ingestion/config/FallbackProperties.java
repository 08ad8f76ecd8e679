/*
 * どこで: Ingestion アプリの設定バインド
 * 何を: フォールバック保存分の回収ポーリング/バッチ/最大再送回数を保持する
 * なぜ: ブローカー復旧後の再送ペースと諦める閾値を運用で調整するため
 */
package com.example.fanout.ingestion.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "ingestion.fallback")
@Validated
public record FallbackProperties(
    boolean recoveryEnabled,
    @NotNull Duration pollInterval,
    @Positive int batchSize,
    @Positive int maxRetries,
    @Positive int errorMessageMaxLength) {

  @AssertTrue(message = "ingestion.fallback.poll-interval must be positive")
  public boolean isPollIntervalPositive() {
    return pollInterval != null && !pollInterval.isZero() && !pollInterval.isNegative();
  }
}
