/*
 * どこで: Ingestion の Kafka 送信
 * 何を: イベントを targetId キー + priority/type/timestamp ヘッダー付きで同期送信する
 * なぜ: ブローカーの ack を確認できた時だけ成功とし、失敗を呼び出し元でフォールバックに回すため
 */
package com.example.fanout.ingestion.kafka;

import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.common.event.NotificationEventCodec;
import com.example.fanout.common.event.NotificationHeaders;
import com.example.fanout.common.kafka.RecordMdc;
import com.example.fanout.ingestion.config.IngestionKafkaProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Producer は Spring 管理の共有クライアントで防御的コピーが不可能なため")
public class KafkaEventSender {

  private static final String TIMESTAMP_HEADER = "timestamp";

  private final Producer<String, String> producer;
  private final NotificationEventCodec codec;
  private final IngestionKafkaProperties properties;

  public KafkaEventSender(
      Producer<String, String> producer,
      NotificationEventCodec codec,
      IngestionKafkaProperties properties) {
    this.producer = producer;
    this.codec = codec;
    this.properties = properties;
  }

  public RecordMetadata send(String topic, NotificationEvent event) {
    ProducerRecord<String, String> record =
        new ProducerRecord<>(topic, event.targetId(), codec.encode(event));
    addHeader(record, NotificationHeaders.PRIORITY, event.effectivePriority().name());
    addHeader(record, NotificationHeaders.TYPE, event.type().name());
    addHeader(record, RecordMdc.EVENT_ID_HEADER, event.id());
    if (event.timestamp() != null) {
      addHeader(record, TIMESTAMP_HEADER, event.timestamp().toString());
    }
    try {
      return producer
          .send(record)
          .get(properties.sendTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new BrokerSendException("interrupted while publishing to " + topic, ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      throw new BrokerSendException("publish to " + topic + " failed: " + cause.getMessage(), cause);
    } catch (TimeoutException ex) {
      throw new BrokerSendException("publish to " + topic + " timed out", ex);
    } catch (KafkaException ex) {
      // メタデータ取得待ち (max.block.ms) の超過などは send 呼び出し自体から投げられる
      throw new BrokerSendException("publish to " + topic + " failed: " + ex.getMessage(), ex);
    }
  }

  private static void addHeader(ProducerRecord<String, String> record, String key, String value) {
    if (value != null) {
      record.headers().add(key, value.getBytes(StandardCharsets.UTF_8));
    }
  }
}
