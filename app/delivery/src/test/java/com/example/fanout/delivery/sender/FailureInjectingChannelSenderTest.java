/*
 * どこで: Delivery 送信層のユニットテスト
 * 何を: CI/Test 専用失敗注入 Sender の分岐と注入エラーの分類を検証する
 * なぜ: retry -> DLQ 検証シナリオの前提が壊れないようにするため
 */
package com.example.fanout.delivery.sender;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.example.fanout.common.event.DeliveryChannel;
import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.common.retry.DeliveryFailureException;
import com.example.fanout.common.retry.RetryableErrorClassifier;
import com.example.fanout.delivery.TestEvents;
import java.lang.reflect.Field;
import org.junit.jupiter.api.Test;

class FailureInjectingChannelSenderTest {

  @Test
  void sendThrowsRetryableFailureWhenPrefixMatches() {
    final LocalChannelSender delegate = mock(LocalChannelSender.class);
    final FailureInjectingChannelSender sender = newSender(delegate, "e2e-dlq-", "ETIMEDOUT");

    final DeliveryFailureException failure =
        catchThrowableOfType(
            () -> sender.send(DeliveryChannel.SMS, TestEvents.otp("evt-1", "e2e-dlq-user-1")),
            DeliveryFailureException.class);

    assertThat(failure).hasMessageContaining("failure injection");
    assertThat(failure.code()).isEqualTo("ETIMEDOUT");
    assertThat(RetryableErrorClassifier.isRetryable(failure)).isTrue();
    verifyNoInteractions(delegate);
  }

  @Test
  void configuredCodeCanMakeInjectedFailurePermanent() {
    final FailureInjectingChannelSender sender =
        newSender(mock(LocalChannelSender.class), "e2e-dlq-", "INVALID_NUMBER");

    final DeliveryFailureException failure =
        catchThrowableOfType(
            () -> sender.send(DeliveryChannel.SMS, TestEvents.otp("evt-1", "e2e-dlq-user-1")),
            DeliveryFailureException.class);

    assertThat(RetryableErrorClassifier.isRetryable(failure)).isFalse();
  }

  @Test
  void sendDelegatesWhenPrefixDoesNotMatch() {
    final LocalChannelSender delegate = mock(LocalChannelSender.class);
    final FailureInjectingChannelSender sender = newSender(delegate, "e2e-dlq-", "ETIMEDOUT");
    final NotificationEvent event = TestEvents.otp("evt-1", "normal-user-1");

    assertThatCode(() -> sender.send(DeliveryChannel.EMAIL, event)).doesNotThrowAnyException();

    verify(delegate).send(DeliveryChannel.EMAIL, event);
  }

  @Test
  void sendDelegatesWhenPrefixIsBlank() {
    final LocalChannelSender delegate = mock(LocalChannelSender.class);
    final FailureInjectingChannelSender sender = newSender(delegate, "", "ETIMEDOUT");
    final NotificationEvent event = TestEvents.otp("evt-1", "e2e-dlq-user-1");

    assertThatCode(() -> sender.send(DeliveryChannel.PUSH, event)).doesNotThrowAnyException();

    verify(delegate).send(DeliveryChannel.PUSH, event);
  }

  private FailureInjectingChannelSender newSender(
      LocalChannelSender delegate, String prefix, String code) {
    final FailureInjectingChannelSender sender = new FailureInjectingChannelSender(delegate);
    setField(sender, "targetIdPrefix", prefix);
    setField(sender, "errorCode", code);
    return sender;
  }

  private void setField(FailureInjectingChannelSender sender, String name, String value) {
    try {
      final Field field = FailureInjectingChannelSender.class.getDeclaredField(name);
      field.setAccessible(true);
      field.set(sender, value);
    } catch (ReflectiveOperationException ex) {
      throw new AssertionError("failed to set " + name + " for test setup", ex);
    }
  }
}
