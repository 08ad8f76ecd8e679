/*
 * どこで: 共通リトライエンジン
 * 何を: 操作を一時的エラーの間だけ指数バックオフで再実行する
 * なぜ: 外部プロバイダの瞬断を吸収しつつ、恒久エラーは即座に呼び出し元へ返すため
 */
package com.example.fanout.common.retry;

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RetryExecutor {

  private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

  private final RetryPolicy policy;
  private final BackoffCalculator backoffCalculator;
  private final RetrySleeper sleeper;

  public RetryExecutor(RetryPolicy policy) {
    this(policy, RetrySleeper.uninterruptible());
  }

  @VisibleForTesting
  public RetryExecutor(RetryPolicy policy, RetrySleeper sleeper) {
    this.policy = policy;
    this.backoffCalculator = new BackoffCalculator(policy);
    this.sleeper = sleeper;
  }

  public RetryPolicy policy() {
    return policy;
  }

  /**
   * 操作を実行する。
   *
   * @throws RetryFailedException 恒久エラー、または試行回数 ({@code maxRetries + 1}) を使い切った場合
   */
  public <T> T execute(Supplier<T> operation, String context) {
    int attempt = 0;
    while (true) {
      attempt++;
      try {
        return operation.get();
      } catch (RuntimeException ex) {
        if (!RetryableErrorClassifier.isRetryable(ex)) {
          logger.warn("{} failed with non-retryable error attempt={}", context, attempt, ex);
          throw new RetryFailedException(context, ex, attempt, false);
        }
        if (attempt > policy.maxRetries()) {
          logger.warn("{} exhausted retries attempts={}", context, attempt, ex);
          throw new RetryFailedException(context, ex, attempt, true);
        }
        Duration delay = backoffCalculator.delay(attempt - 1);
        logger.info(
            "{} failed with retryable error attempt={} nextDelayMs={} error={}",
            context,
            attempt,
            delay.toMillis(),
            ex.getMessage());
        sleeper.sleep(delay);
      }
    }
  }

  public void run(Runnable operation, String context) {
    execute(
        () -> {
          operation.run();
          return null;
        },
        context);
  }
}
