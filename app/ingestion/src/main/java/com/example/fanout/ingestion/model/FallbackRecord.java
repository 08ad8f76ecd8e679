package com.example.fanout.ingestion.model;

import com.example.fanout.common.event.NotificationPriority;
import java.time.Instant;

/** ブローカーへ送れなかったイベントの永続コピー。 */
public record FallbackRecord(
    String id,
    String eventData,
    String topic,
    NotificationPriority priority,
    String targetId,
    boolean processed,
    Instant processedAt,
    int retryCount,
    Instant lastRetryAt,
    String lastError,
    Instant createdAt) {

  public static FallbackRecord pending(
      String id,
      String eventData,
      String topic,
      NotificationPriority priority,
      String targetId,
      String lastError,
      Instant createdAt) {
    return new FallbackRecord(
        id, eventData, topic, priority, targetId, false, null, 0, null, lastError, createdAt);
  }
}
