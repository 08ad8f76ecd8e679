package com.example.fanout.ingestion.model;

import com.example.fanout.common.event.NotificationPriority;
import com.example.fanout.common.event.NotificationType;
import com.example.fanout.common.event.TargetType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.Map;
import lombok.Builder;

/**
 * 取り込み要求。priority を省略すると種別の既定優先度になる。
 */
@Builder
public record IngestRequest(
    @NotNull NotificationType type,
    @NotBlank @Size(max = 64) String actorId,
    String actorName,
    String actorAvatar,
    @NotBlank @Size(max = 64) String targetId,
    TargetType targetType,
    String targetEntityId,
    String title,
    String message,
    String imageUrl,
    NotificationPriority priority,
    Map<String, Object> metadata) {}
