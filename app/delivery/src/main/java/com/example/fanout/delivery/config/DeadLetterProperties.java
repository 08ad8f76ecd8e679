/*
 * どこで: Delivery アプリの設定バインド
 * 何を: DLQ トピック名の接頭辞、パーティション数、保持期間、恒久エラーの扱いを保持する
 * なぜ: 失敗通知の保管先と調査期間を環境ごとに決めるため
 */
package com.example.fanout.delivery.config;

import com.example.fanout.common.event.DeliveryChannel;
import com.example.fanout.common.kafka.TopicSpec;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * @param topicPrefix チャネル名 (小文字) を連結してトピック名にする
 * @param includeNonRetryable true なら恒久エラーも DLQ へ送る。既定は false (ログを残して破棄)
 * @param errorMessageMaxLength DLQ に記録するエラーメッセージの最大長
 */
@ConfigurationProperties(prefix = "delivery.dead-letter")
@Validated
public record DeadLetterProperties(
    @NotBlank String topicPrefix,
    @Positive int partitions,
    @NotNull Duration retention,
    boolean includeNonRetryable,
    @Positive int errorMessageMaxLength) {

  @AssertTrue(message = "delivery.dead-letter.retention must be positive")
  public boolean isRetentionPositive() {
    return retention == null || (!retention.isZero() && !retention.isNegative());
  }

  public String topicFor(DeliveryChannel channel) {
    return topicPrefix + channel.topicSuffix();
  }

  public TopicSpec topicSpec(DeliveryChannel channel, short replicationFactor) {
    return new TopicSpec(topicFor(channel), partitions, replicationFactor, retention);
  }
}
