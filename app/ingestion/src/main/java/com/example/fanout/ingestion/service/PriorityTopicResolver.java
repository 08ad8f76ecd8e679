package com.example.fanout.ingestion.service;

import com.example.fanout.common.event.NotificationPriority;
import com.example.fanout.common.event.NotificationType;
import com.example.fanout.ingestion.config.IngestionKafkaProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** 種別と明示指定から優先度を決め、優先度からトピックを決める。 */
@Component
@RequiredArgsConstructor
public class PriorityTopicResolver {

  private final IngestionKafkaProperties properties;

  public NotificationPriority resolvePriority(NotificationType type, NotificationPriority override) {
    return override != null ? override : type.defaultPriority();
  }

  public String topicFor(NotificationPriority priority) {
    return properties.topics().topicFor(priority);
  }
}
