package com.example.fanout.ingestion.model;

import com.example.fanout.common.event.NotificationPriority;

public record PublishResult(
    String eventId, String topic, NotificationPriority priority, boolean usedFallback) {}
