package com.example.fanout.processing.model;

import com.example.fanout.common.event.NotificationType;
import java.time.Instant;

public record AuditLogEntry(
    String id,
    String eventId,
    String userId,
    NotificationType type,
    AuditStatus status,
    Instant loggedAt,
    Instant expiresAt) {}
