/*
 * どこで: Processing の集約スイープ起動
 * 何を: 専用の単一スレッドで一定間隔ごとにスイープを走らせ、コンテキスト停止時に待ち合わせる
 * なぜ: スイープの開始/停止をコンシューマーと同じ Spring ライフサイクルに揃えるため
 */
package com.example.fanout.processing.service;

import com.example.fanout.processing.config.AggregationProperties;
import com.example.fanout.processing.config.ProcessingKafkaProperties;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "processing.aggregation.sweep-enabled",
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
public class AggregationSweepScheduler implements SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(AggregationSweepScheduler.class);

  private final AggregationSweepService sweepService;
  private final AggregationProperties properties;
  private final ProcessingKafkaProperties kafkaProperties;
  private ScheduledExecutorService executor;
  private volatile boolean running;

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    if (properties.ttlBuffer().compareTo(properties.sweepInterval()) < 0) {
      logger.warn(
          "ttl-buffer is shorter than sweep-interval; windows touched only early may expire"
              + " before a sweep ttlBufferMs={} sweepIntervalMs={}",
          properties.ttlBuffer().toMillis(),
          properties.sweepInterval().toMillis());
    }
    executor =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("aggregation-sweep").build());
    long intervalMs = properties.sweepInterval().toMillis();
    executor.scheduleWithFixedDelay(this::runSweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    running = true;
    logger.info(
        "aggregation sweep started intervalMs={} windowMs={}",
        intervalMs,
        properties.windowDuration().toMillis());
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    executor.shutdown();
    try {
      if (!executor.awaitTermination(
          kafkaProperties.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn("aggregation sweep did not stop within grace");
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
    logger.info("aggregation sweep stopped");
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  private void runSweep() {
    try {
      sweepService.sweep();
    } catch (RuntimeException ex) {
      // 例外で定期実行が止まらないようにする
      logger.error("aggregation sweep failed", ex);
    }
  }
}
