/*
 * どこで: Ingestion サービス層
 * 何を: 直近の送信失敗時刻からブローカーの健全性を推定する
 * なぜ: 停止中のブローカーへ毎回タイムアウトまで待たず、即座にフォールバックへ回すため
 */
package com.example.fanout.ingestion.service;

import com.example.fanout.ingestion.config.BrokerHealthProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class BrokerHealthTracker {

  private static final Logger logger = LoggerFactory.getLogger(BrokerHealthTracker.class);

  private final BrokerHealthProperties properties;
  private final Clock clock;
  private final AtomicReference<Instant> lastFailureAt = new AtomicReference<>();

  public BrokerHealthTracker(BrokerHealthProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
  }

  /** 失敗記録が無いか、最後の失敗から回復猶予を過ぎていれば健全とみなす。 */
  public boolean isHealthy() {
    Instant failedAt = lastFailureAt.get();
    if (failedAt == null) {
      return true;
    }
    return Instant.now(clock).isAfter(failedAt.plus(properties.recoveryWindow()));
  }

  public void recordFailure() {
    Instant now = Instant.now(clock);
    if (lastFailureAt.getAndSet(now) == null) {
      logger.warn("kafka marked unhealthy recoveryWindow={}", properties.recoveryWindow());
    }
  }

  public void recordSuccess() {
    if (lastFailureAt.getAndSet(null) != null) {
      logger.info("kafka marked healthy");
    }
  }

  public Optional<Instant> lastFailureAt() {
    return Optional.ofNullable(lastFailureAt.get());
  }
}
