package com.example.fanout.processing;

import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.common.event.NotificationEventCodec;
import com.example.fanout.common.event.NotificationPriority;
import com.example.fanout.common.event.NotificationType;
import com.example.fanout.common.event.TargetType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;

/** テスト用のイベント/コーデック生成。 */
public final class TestEvents {

  public static final Instant FIXED_NOW = Instant.parse("2026-03-01T00:00:10Z");

  private TestEvents() {}

  public static ObjectMapper objectMapper() {
    return JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .build();
  }

  public static NotificationEventCodec codec() {
    return new NotificationEventCodec(objectMapper());
  }

  /** user-1 の post-1 への LIKE。 */
  public static NotificationEvent like(String eventId, String actorId) {
    return NotificationEvent.builder()
        .id(eventId)
        .type(NotificationType.LIKE)
        .priority(NotificationPriority.HIGH)
        .actorId(actorId)
        .actorName("Name " + actorId)
        .actorAvatar("https://cdn.example.com/" + actorId + ".png")
        .targetId("user-1")
        .targetType(TargetType.POST)
        .targetEntityId("post-1")
        .message("liked your post")
        .timestamp(FIXED_NOW)
        .build();
  }

  public static NotificationEvent otp(String eventId) {
    return NotificationEvent.builder()
        .id(eventId)
        .type(NotificationType.OTP)
        .priority(NotificationPriority.CRITICAL)
        .targetId("user-1")
        .targetType(TargetType.USER)
        .title("Your code")
        .message("123456")
        .timestamp(FIXED_NOW)
        .build();
  }
}
