/*
 * どこで: Delivery のチャネル別コンシューマー
 * 何を: ready レコードをデコードし、担当チャネル分の配信を実行する
 * なぜ: 壊れたペイロードで詰まらず、配信失敗は DLQ 側で完結させるため
 */
package com.example.fanout.delivery.kafka;

import com.example.fanout.common.event.DeliveryChannel;
import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.common.event.NotificationEventCodec;
import com.example.fanout.common.event.NotificationPayloadException;
import com.example.fanout.common.kafka.RecordHandler;
import com.example.fanout.delivery.service.ChannelDeliveryService;
import com.example.fanout.delivery.service.DeliveryMetrics;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ChannelRecordHandler implements RecordHandler {

  private static final Logger logger = LoggerFactory.getLogger(ChannelRecordHandler.class);

  private final DeliveryChannel channel;
  private final NotificationEventCodec codec;
  private final ChannelDeliveryService deliveryService;
  private final DeliveryMetrics metrics;

  public ChannelRecordHandler(
      DeliveryChannel channel,
      NotificationEventCodec codec,
      ChannelDeliveryService deliveryService,
      DeliveryMetrics metrics) {
    this.channel = channel;
    this.codec = codec;
    this.deliveryService = deliveryService;
    this.metrics = metrics;
  }

  @Override
  public void handle(ConsumerRecord<String, String> record) {
    NotificationEvent event;
    try {
      event = codec.decode(record.value());
    } catch (NotificationPayloadException ex) {
      metrics.recordInvalidPayload();
      logger.warn(
          "skipping malformed ready notification channel={} offset={}",
          channel,
          record.offset(),
          ex);
      return;
    }
    // 配信失敗は DLQ 送信/破棄まで ChannelDeliveryService 側で完結する
    deliveryService.deliver(channel, event);
  }

  public DeliveryChannel channel() {
    return channel;
  }
}
