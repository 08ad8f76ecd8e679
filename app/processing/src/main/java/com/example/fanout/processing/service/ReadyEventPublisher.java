/*
 * どこで: Processing の ready ストリーム送信
 * 何を: 確定したイベントを targetId キー + priority/type ヘッダー付きで同期送信する
 * なぜ: ブローカーの ack を待ってからオフセットをコミットし、取りこぼしを防ぐため
 */
package com.example.fanout.processing.service;

import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.common.event.NotificationEventCodec;
import com.example.fanout.common.event.NotificationHeaders;
import com.example.fanout.common.kafka.RecordMdc;
import com.example.fanout.processing.config.ProcessingKafkaProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Producer は Spring 管理の共有クライアントで防御的コピーが不可能なため")
public class ReadyEventPublisher {

  private final Producer<String, String> producer;
  private final NotificationEventCodec codec;
  private final ProcessingKafkaProperties properties;

  public ReadyEventPublisher(
      Producer<String, String> producer,
      NotificationEventCodec codec,
      ProcessingKafkaProperties properties) {
    this.producer = producer;
    this.codec = codec;
    this.properties = properties;
  }

  public void publish(NotificationEvent event) {
    String topic = properties.ready().topic();
    ProducerRecord<String, String> record =
        new ProducerRecord<>(topic, event.targetId(), codec.encode(event));
    addHeader(record, NotificationHeaders.PRIORITY, event.effectivePriority().name());
    addHeader(record, NotificationHeaders.TYPE, event.type().name());
    addHeader(record, RecordMdc.EVENT_ID_HEADER, event.id());
    try {
      producer.send(record).get(properties.sendTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new ReadyPublishException("interrupted while publishing to " + topic, ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      throw new ReadyPublishException(
          "publish to " + topic + " failed: " + cause.getMessage(), cause);
    } catch (TimeoutException ex) {
      throw new ReadyPublishException("publish to " + topic + " timed out", ex);
    } catch (KafkaException ex) {
      throw new ReadyPublishException("publish to " + topic + " failed: " + ex.getMessage(), ex);
    }
  }

  private static void addHeader(ProducerRecord<String, String> record, String key, String value) {
    if (value != null) {
      record.headers().add(key, value.getBytes(StandardCharsets.UTF_8));
    }
  }
}
