package com.example.fanout.delivery.kafka;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.fanout.common.event.DeliveryChannel;
import com.example.fanout.common.retry.RetryPolicy;
import com.example.fanout.delivery.TestEvents;
import com.example.fanout.delivery.TestProperties;
import com.example.fanout.delivery.config.DeliveryChannelProperties;
import com.example.fanout.delivery.config.DeliveryChannelProperties.ChannelProperties;
import com.example.fanout.delivery.service.ChannelDeliveryService;
import com.example.fanout.delivery.service.DeliveryMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChannelDeliveryConsumersTest {

  @Mock private ChannelDeliveryService deliveryService;

  private final List<String> groups = new CopyOnWriteArrayList<>();
  private final List<MockConsumer<String, String>> consumers = new CopyOnWriteArrayList<>();

  @Test
  void startsOneGroupPerChannelOnReadyTopic() {
    ChannelDeliveryConsumers channelConsumers = newConsumers(TestProperties.channels());

    channelConsumers.start();
    Map<String, Integer> running = channelConsumers.runningGroups();
    channelConsumers.stop();

    assertThat(running)
        .containsExactly(
            Map.entry("push-delivery-consumer", 2),
            Map.entry("email-delivery-consumer", 2),
            Map.entry("sms-delivery-consumer", 1));
    assertThat(groups)
        .containsExactly(
            "push-delivery-consumer", "email-delivery-consumer", "sms-delivery-consumer");
    assertThat(consumers).hasSize(5).allSatisfy(consumer -> assertThat(consumer.closed()).isTrue());
    assertThat(channelConsumers.runningGroups()).isEmpty();
  }

  @Test
  void disabledOrMissingChannelIsNotStarted() {
    Map<DeliveryChannel, ChannelProperties> channels = new EnumMap<>(DeliveryChannel.class);
    channels.put(
        DeliveryChannel.PUSH,
        new ChannelProperties(true, "push-delivery-consumer", 1, RetryPolicy.noRetry()));
    channels.put(
        DeliveryChannel.SMS,
        new ChannelProperties(false, "sms-delivery-consumer", 1, TestProperties.SMS_RETRY));
    ChannelDeliveryConsumers channelConsumers =
        newConsumers(new DeliveryChannelProperties(channels));

    channelConsumers.start();
    Map<String, Integer> running = channelConsumers.runningGroups();
    channelConsumers.stop();

    assertThat(running).containsOnlyKeys("push-delivery-consumer");
    assertThat(groups).containsExactly("push-delivery-consumer");
  }

  private ChannelDeliveryConsumers newConsumers(DeliveryChannelProperties channelProperties) {
    return new ChannelDeliveryConsumers(
        TestProperties.kafka(),
        channelProperties,
        groupId -> {
          groups.add(groupId);
          return instanceName -> {
            MockConsumer<String, String> consumer = new MockConsumer<>(OffsetResetStrategy.LATEST);
            consumers.add(consumer);
            return consumer;
          };
        },
        TestEvents.codec(),
        deliveryService,
        new DeliveryMetrics(new SimpleMeterRegistry()));
  }
}
