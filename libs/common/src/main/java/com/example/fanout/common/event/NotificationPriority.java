/*
 * どこで: 共通イベントモデル
 * 何を: 通知の優先度ティアを表す
 * なぜ: ティアごとにトピック/コンシューマーグループ/保持期間を分離するため
 */
package com.example.fanout.common.event;

public enum NotificationPriority {
  CRITICAL,
  HIGH,
  LOW
}
