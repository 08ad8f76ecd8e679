/*
 * どこで: Delivery 送信層
 * 何を: CI/Test 専用でチャネル送信失敗を注入する Sender
 * なぜ: 実コード経路を汚さずに E2E で retry -> DLQ を再現するため
 */
package com.example.fanout.delivery.sender;

import com.example.fanout.common.event.DeliveryChannel;
import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.common.retry.DeliveryFailureException;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "delivery.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingChannelSender implements ChannelSender {

  private final LocalChannelSender delegate;

  @Value("${delivery.failure-injection.target-id-prefix:}")
  private String targetIdPrefix;

  // 既定は一時的エラー扱いのコード。恒久エラーを試すときは任意の値に変える
  @Value("${delivery.failure-injection.error-code:ETIMEDOUT}")
  private String errorCode;

  @Override
  public void send(DeliveryChannel channel, NotificationEvent event) {
    if (shouldInjectFailure(event.targetId())) {
      throw DeliveryFailureException.withCode(
          "delivery failure injection matched channel=" + channel + " targetId=" + event.targetId(),
          errorCode);
    }
    delegate.send(channel, event);
  }

  private boolean shouldInjectFailure(String targetId) {
    if (targetIdPrefix == null || targetIdPrefix.isBlank()) {
      return false;
    }
    return targetId.startsWith(targetIdPrefix);
  }
}
