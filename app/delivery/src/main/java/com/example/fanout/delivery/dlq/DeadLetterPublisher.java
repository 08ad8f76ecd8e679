/*
 * どこで: Delivery の DLQ
 * 何を: 配信を諦めた通知をチャネル別 DLQ トピックへ書き込む。トピックは初回利用時に作成する
 * なぜ: 失敗通知を 30 日間保持して調査/再送できるようにし、DLQ 障害でコンシューマーを止めないため
 */
package com.example.fanout.delivery.dlq;

import com.example.fanout.common.event.DeliveryChannel;
import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.common.event.NotificationEventCodec;
import com.example.fanout.common.event.NotificationHeaders;
import com.example.fanout.common.kafka.RecordMdc;
import com.example.fanout.common.kafka.TopicProvisioner;
import com.example.fanout.common.kafka.TopicProvisioningException;
import com.example.fanout.delivery.config.DeadLetterProperties;
import com.example.fanout.delivery.config.DeliveryKafkaProperties;
import com.example.fanout.delivery.service.DeliveryMetrics;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Producer/TopicProvisioner は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class DeadLetterPublisher {

  private static final Logger logger = LoggerFactory.getLogger(DeadLetterPublisher.class);

  private final Producer<String, String> producer;
  private final TopicProvisioner topicProvisioner;
  private final NotificationEventCodec codec;
  private final DeadLetterProperties properties;
  private final DeliveryKafkaProperties kafkaProperties;
  private final DeliveryMetrics metrics;
  private final Clock clock;
  private final Set<DeliveryChannel> provisionedChannels = ConcurrentHashMap.newKeySet();

  public DeadLetterPublisher(
      Producer<String, String> producer,
      TopicProvisioner topicProvisioner,
      NotificationEventCodec codec,
      DeadLetterProperties properties,
      DeliveryKafkaProperties kafkaProperties,
      DeliveryMetrics metrics,
      Clock clock) {
    this.producer = producer;
    this.topicProvisioner = topicProvisioner;
    this.codec = codec;
    this.properties = properties;
    this.kafkaProperties = kafkaProperties;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * DLQ へ 1 件書き込む。失敗しても例外は投げない。
   *
   * @return 書き込めた場合 true
   */
  public boolean publish(
      DeliveryChannel channel, NotificationEvent event, String errorMessage, int attemptCount) {
    String topic = properties.topicFor(channel);
    DeadLetterEnvelope envelope =
        DeadLetterEnvelope.of(
            event, channel, truncateError(errorMessage), attemptCount, clock.instant());
    try {
      ensureTopic(channel);
      ProducerRecord<String, String> record =
          new ProducerRecord<>(topic, event.targetId(), codec.encode(envelope));
      addHeader(record, NotificationHeaders.CHANNEL, channel.name());
      addHeader(record, NotificationHeaders.PRIORITY, event.effectivePriority().name());
      addHeader(record, NotificationHeaders.TYPE, event.type().name());
      addHeader(record, RecordMdc.EVENT_ID_HEADER, event.id());
      producer.send(record).get(kafkaProperties.sendTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return failed(channel, event, topic, ex);
    } catch (ExecutionException
        | TimeoutException
        | KafkaException
        | TopicProvisioningException ex) {
      return failed(channel, event, topic, ex);
    }
    metrics.recordDeadLetterPublished(channel);
    logger.warn(
        "notification dead-lettered channel={} eventId={} topic={} attempts={} error={}",
        channel,
        event.id(),
        topic,
        attemptCount,
        envelope.dlqMetadata().errorMessage());
    return true;
  }

  private void ensureTopic(DeliveryChannel channel) {
    if (provisionedChannels.contains(channel)) {
      return;
    }
    // 並行して作成しても TopicProvisioner 側で既存扱いになる
    topicProvisioner.ensureTopic(
        properties.topicSpec(channel, kafkaProperties.replicationFactor()));
    provisionedChannels.add(channel);
  }

  private boolean failed(
      DeliveryChannel channel, NotificationEvent event, String topic, Exception ex) {
    metrics.recordDeadLetterFailure(channel);
    logger.error(
        "dead-letter publish failed, notification lost channel={} eventId={} topic={}",
        channel,
        event.id(),
        topic,
        ex);
    return false;
  }

  private String truncateError(String message) {
    if (message == null) {
      return null;
    }
    int max = properties.errorMessageMaxLength();
    if (message.length() <= max) {
      return message;
    }
    return message.substring(0, max);
  }

  private static void addHeader(ProducerRecord<String, String> record, String key, String value) {
    record.headers().add(key, value.getBytes(StandardCharsets.UTF_8));
  }
}
