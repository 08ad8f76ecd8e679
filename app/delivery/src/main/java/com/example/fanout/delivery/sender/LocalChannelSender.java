/*
 * どこで: Delivery 送信層
 * 何を: チャネル送信を模擬する実装
 * なぜ: 外部プロバイダを伴わずにリトライ/DLQ の経路を動かすため
 */
package com.example.fanout.delivery.sender;

import com.example.fanout.common.event.DeliveryChannel;
import com.example.fanout.common.event.NotificationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalChannelSender implements ChannelSender {

  private static final Logger logger = LoggerFactory.getLogger(LocalChannelSender.class);

  @Override
  public void send(DeliveryChannel channel, NotificationEvent event) {
    // 実送信は行わず、ログに残すだけとする
    logger.info(
        "notification simulated send channel={} eventId={} targetId={} type={}",
        channel,
        event.id(),
        event.targetId(),
        event.type());
  }
}
