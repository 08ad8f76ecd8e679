/*
 * どこで: Kafka コンシューマー共通処理
 * 何を: 同一グループのコンシューマーを指定並列数だけ専用スレッドで動かす
 * なぜ: ティア/チャネルごとに独立したグループと並列度を持たせるため
 */
package com.example.fanout.common.kafka;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ConsumerGroupRunner {

  private static final Logger logger = LoggerFactory.getLogger(ConsumerGroupRunner.class);

  private final String groupName;
  private final String topic;
  private final int concurrency;
  private final ConsumerFactory consumerFactory;
  private final RecordHandler handler;
  private final ConsumerSettings settings;
  private final List<ConsumerWorker> workers = new ArrayList<>();
  private final AtomicBoolean started = new AtomicBoolean(false);
  private ExecutorService executor;

  public ConsumerGroupRunner(
      String groupName,
      String topic,
      int concurrency,
      ConsumerFactory consumerFactory,
      RecordHandler handler,
      ConsumerSettings settings) {
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be >= 1 group=" + groupName);
    }
    this.groupName = groupName;
    this.topic = topic;
    this.concurrency = concurrency;
    this.consumerFactory = consumerFactory;
    this.handler = handler;
    this.settings = settings;
  }

  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    executor =
        Executors.newFixedThreadPool(
            concurrency, new ThreadFactoryBuilder().setNameFormat(groupName + "-%d").build());
    for (int i = 0; i < concurrency; i++) {
      String instanceName = groupName + "-" + i;
      ConsumerWorker worker =
          new ConsumerWorker(
              instanceName,
              topic,
              consumerFactory.create(instanceName),
              handler,
              settings.pollTimeout(),
              settings.transientBackoff());
      workers.add(worker);
      executor.submit(worker);
    }
    logger.info("consumer group started group={} topic={} concurrency={}", groupName, topic, concurrency);
  }

  public void stop() {
    if (!started.compareAndSet(true, false)) {
      return;
    }
    workers.forEach(ConsumerWorker::shutdown);
    executor.shutdown();
    Duration grace = settings.shutdownGrace();
    try {
      if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn("consumer group did not stop within grace group={} graceMs={}", groupName, grace.toMillis());
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
    workers.clear();
    logger.info("consumer group stopped group={}", groupName);
  }

  public boolean isRunning() {
    return started.get();
  }

  public String groupName() {
    return groupName;
  }

  public String topic() {
    return topic;
  }

  public int concurrency() {
    return concurrency;
  }
}
