/*
 * どこで: Kafka コンシューマー共通処理
 * 何を: 1 コンシューマー分のポーリングループ。パーティション内は順序通りに処理し、処理後にコミットする
 * なぜ: at-least-once を保ちつつ、一時障害時は同じレコードから再開させるため
 */
package com.example.fanout.common.kafka;

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ConsumerWorker implements Runnable {

  private static final Logger logger = LoggerFactory.getLogger(ConsumerWorker.class);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final String name;
  private final String topic;
  private final Consumer<String, String> consumer;
  private final RecordHandler handler;
  private final Duration pollTimeout;
  private final Duration transientBackoff;
  private final AtomicBoolean running = new AtomicBoolean(true);
  // 一時障害で止めたパーティションと再開時刻 (System.nanoTime 基準)
  private final Map<TopicPartition, Long> pausedUntil = new HashMap<>();

  public ConsumerWorker(
      String name,
      String topic,
      Consumer<String, String> consumer,
      RecordHandler handler,
      Duration pollTimeout,
      Duration transientBackoff) {
    this.name = name;
    this.topic = topic;
    this.consumer = consumer;
    this.handler = handler;
    this.pollTimeout = pollTimeout;
    this.transientBackoff = transientBackoff;
  }

  public String name() {
    return name;
  }

  @Override
  public void run() {
    logger.info("consumer started name={} topic={}", name, topic);
    try {
      subscribe();
      while (running.get()) {
        try {
          pollOnce();
        } catch (WakeupException ex) {
          if (running.get()) {
            logger.debug("unexpected wakeup ignored name={}", name);
          }
        } catch (KafkaException ex) {
          // ブローカー瞬断などはループを継続し、クライアント側の再接続に任せる
          logger.warn("poll failed name={} topic={}", name, topic, ex);
        }
      }
    } finally {
      closeQuietly();
      logger.info("consumer stopped name={} topic={}", name, topic);
    }
  }

  @VisibleForTesting
  void subscribe() {
    consumer.subscribe(
        List.of(topic),
        new ConsumerRebalanceListener() {
          @Override
          public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
            partitions.forEach(pausedUntil::remove);
          }

          @Override
          public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
            logger.info("partitions assigned name={} partitions={}", name, partitions);
          }
        });
  }

  @VisibleForTesting
  void pollOnce() {
    resumeExpiredPauses();
    ConsumerRecords<String, String> records = consumer.poll(pollTimeout);
    if (records.isEmpty()) {
      return;
    }
    Map<TopicPartition, OffsetAndMetadata> processed = new HashMap<>();
    for (TopicPartition partition : records.partitions()) {
      for (ConsumerRecord<String, String> record : records.records(partition)) {
        if (!running.get()) {
          break;
        }
        if (!handle(record)) {
          // 失敗したレコードから読み直させ、後続レコードを追い越させない
          consumer.seek(partition, record.offset());
          consumer.pause(List.of(partition));
          pausedUntil.put(partition, System.nanoTime() + transientBackoff.toNanos());
          break;
        }
        processed.put(partition, new OffsetAndMetadata(record.offset() + 1));
      }
    }
    if (!processed.isEmpty()) {
      commit(processed);
    }
  }

  private void commit(Map<TopicPartition, OffsetAndMetadata> processed) {
    try {
      consumer.commitSync(processed);
    } catch (WakeupException ex) {
      if (running.get()) {
        throw ex;
      }
      // 処理中に停止要求の wakeup が入った。wakeup は一度きりなので再コミットは通る
      logger.debug("commit interrupted by shutdown, retrying name={}", name);
      consumer.commitSync(processed);
    }
  }

  private boolean handle(ConsumerRecord<String, String> record) {
    try (RecordMdc ignored = RecordMdc.open(record)) {
      try {
        handler.handle(record);
        return true;
      } catch (TransientProcessingException ex) {
        logger.warn(
            "transient failure; record will be redelivered name={} offset={}",
            name,
            record.offset(),
            ex);
        return false;
      } catch (RuntimeException ex) {
        logger.error("record skipped after failure name={} offset={}", name, record.offset(), ex);
        return true;
      }
    }
  }

  private void resumeExpiredPauses() {
    if (pausedUntil.isEmpty()) {
      return;
    }
    long now = System.nanoTime();
    Iterator<Map.Entry<TopicPartition, Long>> it = pausedUntil.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<TopicPartition, Long> entry = it.next();
      if (now - entry.getValue() >= 0) {
        consumer.resume(List.of(entry.getKey()));
        it.remove();
      }
    }
  }

  @VisibleForTesting
  Map<TopicPartition, Long> pausedPartitions() {
    return Map.copyOf(pausedUntil);
  }

  /** ループ終了を要求する。ポーリング中なら wakeup で即座に抜け、処理中のレコードは完了させてコミットする。 */
  public void shutdown() {
    if (running.compareAndSet(true, false)) {
      consumer.wakeup();
    }
  }

  private void closeQuietly() {
    try {
      consumer.close(CLOSE_TIMEOUT);
    } catch (RuntimeException ex) {
      logger.warn("consumer close failed name={}", name, ex);
    }
  }
}
