/*
 * どこで: Ingestion サービス層
 * 何を: イベントを Kafka へ送信し、失敗またはブローカー不健全時は DB に退避する
 * なぜ: ブローカー停止中も受け付けたイベントを失わないため
 */
package com.example.fanout.ingestion.service;

import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.common.event.NotificationEventCodec;
import com.example.fanout.ingestion.config.FallbackProperties;
import com.example.fanout.ingestion.kafka.BrokerSendException;
import com.example.fanout.ingestion.kafka.KafkaEventSender;
import com.example.fanout.ingestion.model.FallbackRecord;
import com.example.fanout.ingestion.model.PublishResult;
import com.example.fanout.ingestion.repository.FallbackEventRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationEventPublisher {

  private static final Logger logger = LoggerFactory.getLogger(NotificationEventPublisher.class);
  static final String BROKER_UNHEALTHY_ERROR = "Kafka marked unhealthy";

  private final KafkaEventSender sender;
  private final BrokerHealthTracker healthTracker;
  private final FallbackEventRepository fallbackRepository;
  private final NotificationEventCodec codec;
  private final FallbackProperties fallbackProperties;
  private final IngestionMetrics metrics;
  private final Clock clock;

  public PublishResult publish(NotificationEvent event, String topic) {
    if (!healthTracker.isHealthy()) {
      // 回復猶予中は送信を試みず、タイムアウト待ちを避ける
      return storeInFallback(event, topic, BROKER_UNHEALTHY_ERROR, null);
    }
    try {
      sender.send(topic, event);
    } catch (BrokerSendException ex) {
      healthTracker.recordFailure();
      logger.warn(
          "kafka publish failed; storing in fallback eventId={} topic={}", event.id(), topic, ex);
      return storeInFallback(event, topic, ex.getMessage(), ex);
    }
    healthTracker.recordSuccess();
    metrics.recordPublish("kafka");
    logger.debug("event published eventId={} topic={}", event.id(), topic);
    return new PublishResult(event.id(), topic, event.effectivePriority(), false);
  }

  private PublishResult storeInFallback(
      NotificationEvent event, String topic, String error, BrokerSendException brokerError) {
    FallbackRecord record =
        FallbackRecord.pending(
            event.id(),
            codec.encode(event),
            topic,
            event.effectivePriority(),
            event.targetId(),
            truncateError(error),
            Instant.now(clock));
    try {
      int inserted = fallbackRepository.insert(record);
      if (inserted == 0) {
        logger.info("fallback record already exists eventId={}", event.id());
      }
    } catch (DataAccessException ex) {
      metrics.recordPublish("failed");
      if (brokerError != null) {
        ex.addSuppressed(brokerError);
      }
      logger.error("event lost: kafka and fallback store both failed eventId={}", event.id(), ex);
      throw new EventPublishException("failed to publish or store event " + event.id(), ex);
    }
    metrics.recordPublish("fallback");
    logger.info("event stored in fallback eventId={} topic={}", event.id(), topic);
    return new PublishResult(event.id(), topic, event.effectivePriority(), true);
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    int maxLength = fallbackProperties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }
}
