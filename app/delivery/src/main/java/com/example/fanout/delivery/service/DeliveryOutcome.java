package com.example.fanout.delivery.service;

/** 1 チャネル分の配信結果。 */
public enum DeliveryOutcome {
  DELIVERED,
  /** metadata.channels に含まれないため送信しなかった。 */
  SKIPPED,
  DEAD_LETTERED,
  /** 恒久エラー、または DLQ 送信にも失敗して破棄した。 */
  DROPPED
}
