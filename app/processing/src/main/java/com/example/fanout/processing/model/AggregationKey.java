/*
 * どこで: Processing の集約モデル
 * 何を: (受信者, 種別, 対象エンティティ, ウィンドウ番号) から Redis キーを組み立てる
 * なぜ: 同じウィンドウに入るイベントを全ワーカーで同じキーに寄せるため
 */
package com.example.fanout.processing.model;

import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.common.event.NotificationType;
import java.time.Duration;
import java.time.Instant;

public record AggregationKey(
    String targetUserId, NotificationType type, String targetEntityId, long windowId) {

  private static final String PREFIX = "agg:";
  private static final String META_SUFFIX = ":meta";

  public static AggregationKey of(NotificationEvent event, long windowId) {
    return new AggregationKey(event.targetId(), event.type(), event.targetEntityId(), windowId);
  }

  /** windowId = floor(now / windowDuration)。 */
  public static long windowIdAt(Instant now, Duration windowDuration) {
    return Math.floorDiv(now.toEpochMilli(), windowDuration.toMillis());
  }

  /** agg:{user}:{type}[:{entity}]:{windowId} */
  public String windowKey() {
    StringBuilder key = new StringBuilder(PREFIX).append(targetUserId).append(':').append(type.name());
    if (targetEntityId != null && !targetEntityId.isBlank()) {
      key.append(':').append(targetEntityId);
    }
    return key.append(':').append(windowId).toString();
  }

  public String metaKey() {
    return metaKeyOf(windowKey());
  }

  public static String metaKeyOf(String windowKey) {
    return windowKey + META_SUFFIX;
  }

  /** 指定ウィンドウの全メンバーキーに一致する SCAN パターン。meta キーは含まない。 */
  public static String windowPattern(long windowId) {
    return PREFIX + "*:" + windowId;
  }
}
