/*
 * どこで: Processing のティア別コンシューマー
 * 何を: レコードをデコードして処理サービスへ渡し、例外をコンシューマーの再処理/スキップ判断に変換する
 * なぜ: 壊れたペイロードで詰まらず、ready 送信障害では同じレコードをやり直すため
 */
package com.example.fanout.processing.kafka;

import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.common.event.NotificationEventCodec;
import com.example.fanout.common.event.NotificationPayloadException;
import com.example.fanout.common.event.NotificationPriority;
import com.example.fanout.common.kafka.RecordHandler;
import com.example.fanout.common.kafka.TransientProcessingException;
import com.example.fanout.processing.service.NotificationProcessingService;
import com.example.fanout.processing.service.ProcessingMetrics;
import com.example.fanout.processing.service.ReadyPublishException;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class NotificationRecordHandler implements RecordHandler {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRecordHandler.class);

  private final NotificationPriority tier;
  private final NotificationEventCodec codec;
  private final NotificationProcessingService processingService;
  private final ProcessingMetrics metrics;

  public NotificationRecordHandler(
      NotificationPriority tier,
      NotificationEventCodec codec,
      NotificationProcessingService processingService,
      ProcessingMetrics metrics) {
    this.tier = tier;
    this.codec = codec;
    this.processingService = processingService;
    this.metrics = metrics;
  }

  @Override
  public void handle(ConsumerRecord<String, String> record) {
    NotificationEvent event;
    try {
      event = codec.decode(record.value());
    } catch (NotificationPayloadException ex) {
      metrics.recordInvalidPayload();
      logger.warn("skipping malformed notification tier={} offset={}", tier, record.offset(), ex);
      return;
    }
    try {
      processingService.process(event, tier);
    } catch (ReadyPublishException ex) {
      throw new TransientProcessingException(
          "ready stream unavailable eventId=" + event.id(), ex);
    }
  }

  public NotificationPriority tier() {
    return tier;
  }
}
