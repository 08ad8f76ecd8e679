package com.example.fanout.common.kafka;

import java.time.Duration;
import java.util.Map;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.config.TopicConfig;

/** 起動時に確保するトピック定義。 */
public record TopicSpec(String name, int partitions, short replicationFactor, Duration retention) {

  public TopicSpec {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("topic name must be set");
    }
    if (partitions < 1) {
      throw new IllegalArgumentException("partitions must be >= 1 topic=" + name);
    }
    if (replicationFactor < 1) {
      throw new IllegalArgumentException("replicationFactor must be >= 1 topic=" + name);
    }
  }

  NewTopic toNewTopic() {
    NewTopic topic = new NewTopic(name, partitions, replicationFactor);
    if (retention != null) {
      topic.configs(Map.of(TopicConfig.RETENTION_MS_CONFIG, Long.toString(retention.toMillis())));
    }
    return topic;
  }
}
