package com.example.fanout.ingestion.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** 直近の送信失敗から、ブローカーが回復したとみなすまでの時間。 */
@ConfigurationProperties(prefix = "ingestion.broker-health")
@Validated
public record BrokerHealthProperties(@NotNull Duration recoveryWindow) {

  @AssertTrue(message = "ingestion.broker-health.recovery-window must be positive")
  public boolean isRecoveryWindowPositive() {
    return recoveryWindow != null && !recoveryWindow.isZero() && !recoveryWindow.isNegative();
  }
}
