/*
 * どこで: Ingestion のフォールバック回収ワーカー
 * 何を: スケジュールで退避分の再送を起動する
 * なぜ: ブローカー復旧を待って定期的に退避分を本流へ戻すため
 */
package com.example.fanout.ingestion.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "ingestion.fallback.recovery-enabled",
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
public class FallbackRecoveryWorker {

  private final FallbackRecoveryService recoveryService;

  @Scheduled(fixedDelayString = "${ingestion.fallback.poll-interval}")
  public void run() {
    recoveryService.recoverBatch();
  }
}
