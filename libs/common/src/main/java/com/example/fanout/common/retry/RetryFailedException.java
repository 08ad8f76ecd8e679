package com.example.fanout.common.retry;

/** リトライを諦めた操作。最後の例外を cause に持つ。 */
public class RetryFailedException extends RuntimeException {

  private final int attempts;
  private final boolean retryable;

  public RetryFailedException(String context, Throwable lastError, int attempts, boolean retryable) {
    super(
        context + " failed after " + attempts + " attempt(s): " + messageOf(lastError), lastError);
    this.attempts = attempts;
    this.retryable = retryable;
  }

  public int attempts() {
    return attempts;
  }

  /** 最後のエラーが一時的エラーだった (= 試行回数切れで諦めた) か。 */
  public boolean retryable() {
    return retryable;
  }

  public String lastErrorMessage() {
    return messageOf(getCause());
  }

  private static String messageOf(Throwable error) {
    if (error == null) {
      return "unknown error";
    }
    return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
  }
}
