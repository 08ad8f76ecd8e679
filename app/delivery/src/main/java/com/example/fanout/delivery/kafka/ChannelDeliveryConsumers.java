/*
 * どこで: Delivery のチャネル別コンシューマー起動
 * 何を: PUSH/EMAIL/SMS ごとに独立したコンシューマーグループで ready トピックを購読する
 * なぜ: 遅いプロバイダの再送待機が他チャネルの配信を遅らせないようにするため
 */
package com.example.fanout.delivery.kafka;

import com.example.fanout.common.event.DeliveryChannel;
import com.example.fanout.common.event.NotificationEventCodec;
import com.example.fanout.common.kafka.ConsumerGroupRunner;
import com.example.fanout.common.kafka.GroupConsumerFactory;
import com.example.fanout.delivery.config.DeliveryChannelProperties;
import com.example.fanout.delivery.config.DeliveryChannelProperties.ChannelProperties;
import com.example.fanout.delivery.config.DeliveryKafkaProperties;
import com.example.fanout.delivery.service.ChannelDeliveryService;
import com.example.fanout.delivery.service.DeliveryMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "delivery.kafka.consumers-enabled",
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
public class ChannelDeliveryConsumers {

  private static final Logger logger = LoggerFactory.getLogger(ChannelDeliveryConsumers.class);

  private final DeliveryKafkaProperties kafkaProperties;
  private final DeliveryChannelProperties channelProperties;
  private final GroupConsumerFactory consumerFactory;
  private final NotificationEventCodec codec;
  private final ChannelDeliveryService deliveryService;
  private final DeliveryMetrics metrics;
  private final List<ConsumerGroupRunner> runners = new ArrayList<>();

  @PostConstruct
  public void start() {
    for (DeliveryChannel channel : DeliveryChannel.values()) {
      ChannelProperties properties = channelProperties.channel(channel).orElse(null);
      if (properties == null || !properties.enabled()) {
        logger.info("channel consumer disabled channel={}", channel);
        continue;
      }
      ConsumerGroupRunner runner =
          new ConsumerGroupRunner(
              properties.groupId(),
              kafkaProperties.readyTopic(),
              properties.concurrency(),
              consumerFactory.forGroup(properties.groupId()),
              new ChannelRecordHandler(channel, codec, deliveryService, metrics),
              kafkaProperties.toConsumerSettings());
      runner.start();
      runners.add(runner);
    }
  }

  @PreDestroy
  public void stop() {
    // 再送待機中のレコードは shutdown-grace の範囲で完了を待つ
    for (ConsumerGroupRunner runner : runners) {
      runner.stop();
    }
    runners.clear();
  }

  /** 起動中のグループ名と並列数。 */
  public Map<String, Integer> runningGroups() {
    Map<String, Integer> groups = new LinkedHashMap<>();
    for (ConsumerGroupRunner runner : runners) {
      if (runner.isRunning()) {
        groups.put(runner.groupName(), runner.concurrency());
      }
    }
    return Collections.unmodifiableMap(groups);
  }
}
