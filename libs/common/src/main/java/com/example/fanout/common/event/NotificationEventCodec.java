/*
 * どこで: 共通イベントモデル
 * 何を: NotificationEvent と JSON 文字列を相互変換し、必須項目を検証する
 * なぜ: 壊れたレコードを恒久失敗として早期に分類するため
 */
package com.example.fanout.common.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotificationEventCodec {

  private final ObjectMapper objectMapper;

  public NotificationEventCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public NotificationEvent decode(String json) {
    if (json == null || json.isBlank()) {
      throw new NotificationPayloadException("payload is empty");
    }
    NotificationEvent event;
    try {
      event = objectMapper.readValue(json, NotificationEvent.class);
    } catch (JsonProcessingException ex) {
      throw new NotificationPayloadException("payload is not a notification event", ex);
    }
    validate(event);
    if (event.priority() == null) {
      event = event.toBuilder().priority(event.effectivePriority()).build();
    }
    return event;
  }

  public String encode(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize " + value.getClass().getSimpleName(), ex);
    }
  }

  private static void validate(NotificationEvent event) {
    if (event == null) {
      throw new NotificationPayloadException("payload is null");
    }
    if (isBlank(event.id())) {
      throw new NotificationPayloadException("id is required");
    }
    if (event.type() == null) {
      throw new NotificationPayloadException("type is required id=" + event.id());
    }
    if (isBlank(event.targetId())) {
      throw new NotificationPayloadException("targetId is required id=" + event.id());
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
