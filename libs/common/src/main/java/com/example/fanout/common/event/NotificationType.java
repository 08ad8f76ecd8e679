/*
 * どこで: 共通イベントモデル
 * 何を: 通知種別と既定優先度/集約可否を定義する
 * なぜ: 取り込み側と処理側で同じ分類表を参照させるため
 */
package com.example.fanout.common.event;

import java.util.EnumSet;
import java.util.Set;

public enum NotificationType {
  OTP(NotificationPriority.CRITICAL),
  PASSWORD_RESET(NotificationPriority.CRITICAL),
  SECURITY_ALERT(NotificationPriority.CRITICAL),
  LIKE(NotificationPriority.HIGH),
  COMMENT(NotificationPriority.HIGH),
  COMMENT_REPLY(NotificationPriority.HIGH),
  FOLLOW(NotificationPriority.HIGH),
  BELL_POST(NotificationPriority.HIGH),
  MENTION(NotificationPriority.HIGH),
  POST_SHARE(NotificationPriority.HIGH),
  STORY_VIEW(NotificationPriority.HIGH),
  MARKETING(NotificationPriority.LOW),
  DIGEST(NotificationPriority.LOW),
  POST_UPDATED(NotificationPriority.LOW);

  // 同一ターゲットへの反応系だけを窓で束ねる。BELL_POST/MENTION は個別に届ける
  private static final Set<NotificationType> AGGREGATABLE =
      EnumSet.of(LIKE, COMMENT, COMMENT_REPLY, FOLLOW, POST_SHARE, STORY_VIEW);

  private final NotificationPriority defaultPriority;

  NotificationType(NotificationPriority defaultPriority) {
    this.defaultPriority = defaultPriority;
  }

  public NotificationPriority defaultPriority() {
    return defaultPriority;
  }

  public boolean isAggregatable() {
    return AGGREGATABLE.contains(this);
  }
}
