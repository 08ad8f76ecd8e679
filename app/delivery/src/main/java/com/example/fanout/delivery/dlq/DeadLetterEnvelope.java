/*
 * どこで: Delivery の DLQ
 * 何を: 元イベントの全フィールドに失敗情報 (dlqMetadata) を添えた DLQ メッセージを表す
 * なぜ: DLQ 側の調査/再投入ツールが元イベントをそのまま読めるようにするため
 */
package com.example.fanout.delivery.dlq;

import com.example.fanout.common.event.DeliveryChannel;
import com.example.fanout.common.event.NotificationEvent;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import java.time.Instant;

public record DeadLetterEnvelope(@JsonUnwrapped NotificationEvent event, DlqMetadata dlqMetadata) {

  public static DeadLetterEnvelope of(
      NotificationEvent event,
      DeliveryChannel failedChannel,
      String errorMessage,
      int attemptCount,
      Instant failedAt) {
    return new DeadLetterEnvelope(
        event,
        new DlqMetadata(failedChannel, errorMessage, attemptCount, failedAt, event.timestamp()));
  }

  /**
   * @param attemptCount 初回を含む送信試行回数
   * @param originalTimestamp 元イベントの timestamp
   */
  public record DlqMetadata(
      DeliveryChannel failedChannel,
      String errorMessage,
      int attemptCount,
      Instant failedAt,
      Instant originalTimestamp) {}
}
