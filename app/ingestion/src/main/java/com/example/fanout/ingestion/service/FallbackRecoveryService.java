/*
 * どこで: Ingestion のフォールバック回収
 * 何を: 退避済みイベントを保存先トピックへ再送し、処理済み/再送回数を更新する
 * なぜ: ブローカー復旧後に退避分を取りこぼさず本流へ戻すため
 */
package com.example.fanout.ingestion.service;

import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.common.event.NotificationEventCodec;
import com.example.fanout.common.event.NotificationPayloadException;
import com.example.fanout.ingestion.config.FallbackProperties;
import com.example.fanout.ingestion.kafka.BrokerSendException;
import com.example.fanout.ingestion.kafka.KafkaEventSender;
import com.example.fanout.ingestion.model.FallbackRecord;
import com.example.fanout.ingestion.model.FallbackStats;
import com.example.fanout.ingestion.repository.FallbackEventRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class FallbackRecoveryService {

  private static final Logger logger = LoggerFactory.getLogger(FallbackRecoveryService.class);

  private final FallbackEventRepository repository;
  private final KafkaEventSender sender;
  private final BrokerHealthTracker healthTracker;
  private final NotificationEventCodec codec;
  private final FallbackProperties properties;
  private final IngestionMetrics metrics;
  private final Clock clock;

  /**
   * 未処理レコードを 1 バッチ分再送する。
   *
   * @return 再送できた件数
   */
  public int recoverBatch() {
    if (!healthTracker.isHealthy()) {
      logger.debug("fallback recovery skipped while kafka is unhealthy");
      refreshStats();
      return 0;
    }
    List<FallbackRecord> records =
        repository.findUnprocessed(properties.maxRetries(), properties.batchSize());
    int recovered = 0;
    for (FallbackRecord record : records) {
      Instant now = Instant.now(clock);
      NotificationEvent event;
      try {
        event = codec.decode(record.eventData());
      } catch (NotificationPayloadException ex) {
        // 再送しても回復しないので上限回数に寄せて回収対象から外す
        repository.markPermanentlyFailed(
            record.id(), properties.maxRetries(), truncateError(ex.getMessage()), now);
        logger.error("fallback record is unreadable and marked failed id={}", record.id(), ex);
        continue;
      }
      try {
        sender.send(record.topic(), event);
      } catch (BrokerSendException ex) {
        healthTracker.recordFailure();
        repository.incrementRetryCount(record.id(), truncateError(ex.getMessage()), now);
        logger.warn(
            "fallback redelivery failed; stopping batch id={} retryCount={}",
            record.id(),
            record.retryCount() + 1,
            ex);
        break;
      }
      healthTracker.recordSuccess();
      repository.markProcessed(record.id(), now);
      recovered++;
    }
    if (recovered > 0) {
      logger.info("fallback records redelivered count={}", recovered);
    }
    metrics.recordRecovered(recovered);
    refreshStats();
    return recovered;
  }

  public FallbackStats stats() {
    return repository.stats(properties.maxRetries());
  }

  private void refreshStats() {
    metrics.updateFallbackStats(stats());
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    int maxLength = properties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }
}
