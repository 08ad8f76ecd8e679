/*
 * どこで: Processing の前段フィルタ
 * 何を: ユーザー設定 (プッシュ無効/カテゴリ/DND) に照らして通知を通すか決める
 * なぜ: 受信者が望まない通知を集約や配信の前に落とすため
 */
package com.example.fanout.processing.service;

import com.example.fanout.common.event.NotificationType;
import com.example.fanout.processing.config.PreferenceProperties;
import com.example.fanout.processing.model.NotificationPreference;
import com.example.fanout.processing.repository.PreferenceRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PreferenceService {

  private static final Logger logger = LoggerFactory.getLogger(PreferenceService.class);

  private final PreferenceRepository preferenceRepository;
  private final PreferenceProperties properties;
  private final ProcessingMetrics metrics;
  private final Clock clock;

  /** 送信してよければ true。設定が無い場合と参照に失敗した場合も true。 */
  public boolean isAllowed(String userId, NotificationType type) {
    Optional<NotificationPreference> found;
    try {
      found = preferenceRepository.findByUserId(userId);
    } catch (RuntimeException ex) {
      metrics.recordPreferenceError();
      logger.warn("preference lookup failed, allowing userId={} type={}", userId, type, ex);
      return true;
    }
    if (found.isEmpty()) {
      return true;
    }
    NotificationPreference pref = found.get();
    if (!pref.pushEnabled()) {
      logger.debug("blocked by push disabled userId={} type={}", userId, type);
      return false;
    }
    if (type == NotificationType.MARKETING && !pref.marketing()) {
      return false;
    }
    if ((type == NotificationType.LIKE || type == NotificationType.COMMENT) && !pref.activity()) {
      return false;
    }
    if (pref.hasDndWindow()) {
      LocalTime now = ZonedDateTime.now(clock.withZone(properties.zoneId())).toLocalTime();
      if (isWithinWindow(now, pref.dndStartTime(), pref.dndEndTime())) {
        logger.debug("blocked by dnd userId={} type={}", userId, type);
        return false;
      }
    }
    return true;
  }

  /** 分単位で比較し、両端を含む。開始 >= 終了なら日付を跨ぐ窓として扱う。 */
  @VisibleForTesting
  static boolean isWithinWindow(LocalTime now, LocalTime start, LocalTime end) {
    int current = now.getHour() * 60 + now.getMinute();
    int startMinutes = start.getHour() * 60 + start.getMinute();
    int endMinutes = end.getHour() * 60 + end.getMinute();
    if (startMinutes < endMinutes) {
      return current >= startMinutes && current <= endMinutes;
    }
    return current >= startMinutes || current <= endMinutes;
  }
}
