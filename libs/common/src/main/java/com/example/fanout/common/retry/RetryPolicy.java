/*
 * どこで: 共通リトライエンジン
 * 何を: 最大リトライ回数と指数バックオフのパラメータを保持する
 * なぜ: チャネルごとに異なる再送方針を設定から差し込むため
 */
package com.example.fanout.common.retry;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

/**
 * @param maxRetries 初回送信の後に許す再試行回数。総試行回数は {@code maxRetries + 1}
 * @param initialDelay 1 回目の再試行前の待機
 * @param maxDelay 待機時間の上限
 * @param backoffMultiplier 再試行ごとの倍率
 */
public record RetryPolicy(
    @Min(0) int maxRetries,
    @NotNull Duration initialDelay,
    @NotNull Duration maxDelay,
    double backoffMultiplier) {

  public static RetryPolicy defaults() {
    return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0d);
  }

  public static RetryPolicy noRetry() {
    return new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 1.0d);
  }

  @AssertTrue(message = "initialDelay must not exceed maxDelay and multiplier must be >= 1")
  public boolean isConsistent() {
    if (initialDelay == null || maxDelay == null) {
      return true;
    }
    return !initialDelay.isNegative()
        && initialDelay.compareTo(maxDelay) <= 0
        && backoffMultiplier >= 1.0d;
  }
}
