package com.example.fanout.processing.model;

import java.time.LocalTime;

public record NotificationPreference(
    String userId,
    boolean pushEnabled,
    boolean marketing,
    boolean activity,
    boolean social,
    boolean dndEnabled,
    LocalTime dndStartTime,
    LocalTime dndEndTime) {

  /** 開始/終了の両方が揃っている時だけ DND を評価する。 */
  public boolean hasDndWindow() {
    return dndEnabled && dndStartTime != null && dndEndTime != null;
  }
}
