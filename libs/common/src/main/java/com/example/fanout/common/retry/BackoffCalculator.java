/*
 * どこで: 共通リトライエンジン
 * 何を: 試行番号から指数バックオフ + ±10% ジッターの待機時間を算出する
 * なぜ: 同時失敗したワーカーの再試行タイミングを分散させるため
 */
package com.example.fanout.common.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public class BackoffCalculator {

  static final double JITTER_RATIO = 0.1d;

  private final RetryPolicy policy;

  public BackoffCalculator(RetryPolicy policy) {
    this.policy = policy;
  }

  /**
   * ジッター前の基準待機時間。{@code min(initial * multiplier^attempt, max)}。
   *
   * @param attempt 0 始まりの再試行番号
   */
  public long baseDelayMillis(int attempt) {
    double initial = policy.initialDelay().toMillis();
    double exp = initial * Math.pow(policy.backoffMultiplier(), Math.max(attempt, 0));
    return (long) Math.min(exp, policy.maxDelay().toMillis());
  }

  public Duration delay(int attempt) {
    long base = baseDelayMillis(attempt);
    if (base <= 0) {
      return Duration.ZERO;
    }
    double factor = ThreadLocalRandom.current().nextDouble() * 2.0d - 1.0d;
    long jittered = Math.round(base + base * JITTER_RATIO * factor);
    // 丸め誤差で ±10% の帯を外れないよう端を詰める
    long lower = (long) Math.ceil(base * (1.0d - JITTER_RATIO));
    long upper = (long) Math.floor(base * (1.0d + JITTER_RATIO));
    return Duration.ofMillis(Math.max(lower, Math.min(upper, jittered)));
  }
}
