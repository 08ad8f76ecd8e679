package com.example.fanout.common.retry;

import com.google.common.util.concurrent.Uninterruptibles;
import java.time.Duration;

/** 再試行間の待機。テストでは実時間を使わない実装に差し替える。 */
@FunctionalInterface
public interface RetrySleeper {

  void sleep(Duration duration);

  static RetrySleeper uninterruptible() {
    return Uninterruptibles::sleepUninterruptibly;
  }
}
