/*
 * どこで: 共通イベントモデル
 * 何を: パイプライン全段を流れる通知イベントを表す
 * なぜ: 取り込み/処理/配信で同じ JSON 形状を共有するため
 */
package com.example.fanout.common.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;

@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationEvent(
    String id,
    NotificationType type,
    NotificationPriority priority,
    String actorId,
    String actorName,
    String actorAvatar,
    String targetId,
    TargetType targetType,
    String targetEntityId,
    String title,
    String message,
    String imageUrl,
    Map<String, Object> metadata,
    Instant timestamp) {

  public NotificationEvent {
    // metadata は null を許容せず、外から変更できない形で保持する
    metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /** 指定キーを追加/上書きした新しいイベントを返す。 */
  public NotificationEvent withMetadata(String key, Object value) {
    Map<String, Object> merged = new LinkedHashMap<>(metadata);
    merged.put(key, value);
    return toBuilder().metadata(merged).build();
  }

  /**
   * metadata.channels に記録された配信許可チャネル。
   *
   * <p>キーが無い場合は empty を返し、全チャネル許可として扱う。未知のチャネル名は無視する。
   */
  @JsonIgnore
  public Optional<Set<DeliveryChannel>> allowedChannels() {
    Object raw = metadata.get(MetadataKeys.CHANNELS);
    if (!(raw instanceof Collection<?> values)) {
      return Optional.empty();
    }
    Set<DeliveryChannel> channels = EnumSet.noneOf(DeliveryChannel.class);
    for (Object value : values) {
      if (value == null) {
        continue;
      }
      String name = value.toString().toUpperCase(Locale.ROOT);
      for (DeliveryChannel channel : DeliveryChannel.values()) {
        if (channel.name().equals(name)) {
          channels.add(channel);
        }
      }
    }
    return Optional.of(channels);
  }

  /** priority 未指定なら種別の既定優先度を返す。 */
  @JsonIgnore
  public NotificationPriority effectivePriority() {
    if (priority != null) {
      return priority;
    }
    return type == null ? NotificationPriority.LOW : type.defaultPriority();
  }
}
