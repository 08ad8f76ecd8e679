package com.example.fanout.processing.service;

import com.example.fanout.common.event.DeliveryChannel;
import com.example.fanout.common.event.NotificationPriority;
import java.util.List;
import org.springframework.stereotype.Component;

/** 優先度から配信チャネルを決める。未知/未指定は PUSH のみ。 */
@Component
public class ChannelSelector {

  private static final List<DeliveryChannel> CRITICAL_CHANNELS =
      List.of(DeliveryChannel.PUSH, DeliveryChannel.EMAIL, DeliveryChannel.SMS);
  private static final List<DeliveryChannel> HIGH_CHANNELS =
      List.of(DeliveryChannel.PUSH, DeliveryChannel.EMAIL);
  private static final List<DeliveryChannel> DEFAULT_CHANNELS = List.of(DeliveryChannel.PUSH);

  public List<DeliveryChannel> channelsFor(NotificationPriority priority) {
    if (priority == null) {
      return DEFAULT_CHANNELS;
    }
    return switch (priority) {
      case CRITICAL -> CRITICAL_CHANNELS;
      case HIGH -> HIGH_CHANNELS;
      case LOW -> DEFAULT_CHANNELS;
    };
  }
}
