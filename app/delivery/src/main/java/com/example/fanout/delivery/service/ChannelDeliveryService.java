/*
 * どこで: Delivery サービス層
 * 何を: 1 チャネル分の送信をチャネルのリトライ方針で実行し、諦めた通知を DLQ へ回す
 * なぜ: 一時的なプロバイダ障害を吸収しつつ、配信できなかった通知を失わないため
 */
package com.example.fanout.delivery.service;

import com.example.fanout.common.event.DeliveryChannel;
import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.common.retry.RetryExecutor;
import com.example.fanout.common.retry.RetryFailedException;
import com.example.fanout.common.retry.RetryPolicy;
import com.example.fanout.common.retry.RetrySleeper;
import com.example.fanout.delivery.config.DeadLetterProperties;
import com.example.fanout.delivery.config.DeliveryChannelProperties;
import com.example.fanout.delivery.config.DeliveryChannelProperties.ChannelProperties;
import com.example.fanout.delivery.dlq.DeadLetterPublisher;
import com.example.fanout.delivery.sender.ChannelSender;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ChannelSender/DeadLetterPublisher は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ChannelDeliveryService {

  private static final Logger logger = LoggerFactory.getLogger(ChannelDeliveryService.class);

  private final ChannelSender sender;
  private final DeadLetterPublisher deadLetterPublisher;
  private final DeadLetterProperties deadLetterProperties;
  private final DeliveryMetrics metrics;
  private final Map<DeliveryChannel, RetryExecutor> executors =
      new EnumMap<>(DeliveryChannel.class);

  public ChannelDeliveryService(
      ChannelSender sender,
      DeadLetterPublisher deadLetterPublisher,
      DeliveryChannelProperties channelProperties,
      DeadLetterProperties deadLetterProperties,
      DeliveryMetrics metrics,
      RetrySleeper sleeper) {
    this.sender = sender;
    this.deadLetterPublisher = deadLetterPublisher;
    this.deadLetterProperties = deadLetterProperties;
    this.metrics = metrics;
    for (DeliveryChannel channel : DeliveryChannel.values()) {
      // 設定の無いチャネルは単発送信
      RetryPolicy policy =
          channelProperties
              .channel(channel)
              .map(ChannelProperties::retry)
              .orElse(RetryPolicy.noRetry());
      executors.put(channel, new RetryExecutor(policy, sleeper));
    }
  }

  public DeliveryOutcome deliver(DeliveryChannel channel, NotificationEvent event) {
    Optional<Set<DeliveryChannel>> allowed = event.allowedChannels();
    if (allowed.isPresent() && !allowed.get().contains(channel)) {
      logger.debug("channel not selected channel={} eventId={}", channel, event.id());
      return record(channel, DeliveryOutcome.SKIPPED);
    }

    AtomicInteger attempts = new AtomicInteger();
    try {
      executors
          .get(channel)
          .run(
              () -> {
                attempts.incrementAndGet();
                sender.send(channel, event);
              },
              "deliver channel=" + channel + " eventId=" + event.id());
    } catch (RetryFailedException ex) {
      metrics.recordAttempts(channel, ex.attempts());
      return handleFailure(channel, event, ex);
    }
    metrics.recordAttempts(channel, attempts.get());
    return record(channel, DeliveryOutcome.DELIVERED);
  }

  public RetryPolicy policyOf(DeliveryChannel channel) {
    return executors.get(channel).policy();
  }

  private DeliveryOutcome handleFailure(
      DeliveryChannel channel, NotificationEvent event, RetryFailedException failure) {
    if (!failure.retryable() && !deadLetterProperties.includeNonRetryable()) {
      logger.warn(
          "delivery failed with non-retryable error, dropping channel={} eventId={} error={}",
          channel,
          event.id(),
          failure.lastErrorMessage());
      return record(channel, DeliveryOutcome.DROPPED);
    }
    boolean published =
        deadLetterPublisher.publish(
            channel, event, failure.lastErrorMessage(), failure.attempts());
    return record(channel, published ? DeliveryOutcome.DEAD_LETTERED : DeliveryOutcome.DROPPED);
  }

  private DeliveryOutcome record(DeliveryChannel channel, DeliveryOutcome outcome) {
    metrics.recordOutcome(channel, outcome);
    return outcome;
  }
}
