/*
 * どこで: Delivery アプリの設定バインド
 * 何を: チャネルごとの有効/無効、コンシューマーグループ、並列数、リトライ方針を保持する
 * なぜ: プロバイダごとに異なるレート制限と再送方針を設定だけで切り替えるため
 */
package com.example.fanout.delivery.config;

import com.example.fanout.common.event.DeliveryChannel;
import com.example.fanout.common.retry.RetryPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.Map;
import java.util.Optional;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "delivery")
@Validated
public record DeliveryChannelProperties(
    @NotEmpty Map<DeliveryChannel, @Valid ChannelProperties> channels) {

  public Optional<ChannelProperties> channel(DeliveryChannel channel) {
    return Optional.ofNullable(channels.get(channel));
  }

  /** 1 チャネル分の購読設定。PUSH は retry.max-retries=0 の単発送信とする。 */
  public record ChannelProperties(
      boolean enabled,
      @NotBlank String groupId,
      @Positive int concurrency,
      @NotNull @Valid RetryPolicy retry) {}
}
