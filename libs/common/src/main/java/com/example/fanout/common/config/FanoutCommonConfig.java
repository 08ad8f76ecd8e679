/*
 * どこで: Common 共通設定
 * 何を: Clock とイベントコーデックを DI 可能にする
 * なぜ: 各アプリで同一の時刻注入と JSON 形状を使うため
 */
package com.example.fanout.common.config;

import com.example.fanout.common.event.NotificationEventCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FanoutCommonConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public NotificationEventCodec notificationEventCodec(ObjectMapper objectMapper) {
    return new NotificationEventCodec(objectMapper);
  }
}
