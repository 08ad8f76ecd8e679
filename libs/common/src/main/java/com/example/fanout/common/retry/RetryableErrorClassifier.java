/*
 * どこで: 共通リトライエンジン
 * 何を: 例外が一時的 (再試行で回復し得る) かを判定する
 * なぜ: 恒久エラーで無駄な再送と DLQ 汚染を起こさないため
 */
package com.example.fanout.common.retry;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.Set;

public final class RetryableErrorClassifier {

  // 接続拒否/タイムアウト/名前解決失敗、Twilio のレート制限 (20429)、SendGrid のレート制限 (429)
  private static final Set<String> RETRYABLE_CODES =
      Set.of("ECONNREFUSED", "ETIMEDOUT", "ENOTFOUND", "20429", "429");
  private static final Set<Integer> RETRYABLE_HTTP_STATUSES = Set.of(429, 503, 504);
  private static final int MAX_CAUSE_DEPTH = 10;

  private RetryableErrorClassifier() {}

  public static boolean isRetryable(Throwable error) {
    Throwable current = error;
    int depth = 0;
    while (current != null && depth < MAX_CAUSE_DEPTH) {
      if (matches(current)) {
        return true;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
      depth++;
    }
    return false;
  }

  private static boolean matches(Throwable error) {
    if (error instanceof DeliveryFailureException failure) {
      if (failure.code() != null && RETRYABLE_CODES.contains(failure.code())) {
        return true;
      }
      return failure.httpStatus() != null && RETRYABLE_HTTP_STATUSES.contains(failure.httpStatus());
    }
    return error instanceof ConnectException
        || error instanceof SocketTimeoutException
        || error instanceof HttpTimeoutException
        || error instanceof UnknownHostException;
  }
}
