/*
 * どこで: Ingestion アプリの設定バインド
 * 何を: ブローカー接続と優先度別トピック名、送信タイムアウトを保持する
 * なぜ: ブローカー停止時にどれだけ待ってフォールバックへ切り替えるかを環境で調整するため
 */
package com.example.fanout.ingestion.config;

import com.example.fanout.common.event.NotificationPriority;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "ingestion.kafka")
@Validated
public record IngestionKafkaProperties(
    @NotBlank String bootstrapServers,
    @NotBlank String clientId,
    @NotNull Duration sendTimeout,
    @NotNull Duration maxBlock,
    @NotNull @Valid Topics topics) {

  @AssertTrue(message = "ingestion.kafka.send-timeout must be positive")
  public boolean isSendTimeoutPositive() {
    return isPositiveDuration(sendTimeout);
  }

  @AssertTrue(message = "ingestion.kafka.max-block must be positive")
  public boolean isMaxBlockPositive() {
    return isPositiveDuration(maxBlock);
  }

  private boolean isPositiveDuration(Duration duration) {
    // null は @NotNull で検出する前提。
    return duration != null && !duration.isZero() && !duration.isNegative();
  }

  public record Topics(@NotBlank String critical, @NotBlank String high, @NotBlank String low) {

    public String topicFor(NotificationPriority priority) {
      return switch (priority) {
        case CRITICAL -> critical;
        case HIGH -> high;
        case LOW -> low;
      };
    }
  }
}
