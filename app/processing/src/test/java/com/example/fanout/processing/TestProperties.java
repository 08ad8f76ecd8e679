package com.example.fanout.processing;

import com.example.fanout.common.event.NotificationPriority;
import com.example.fanout.processing.config.AggregationProperties;
import com.example.fanout.processing.config.ProcessingKafkaProperties;
import com.example.fanout.processing.config.ProcessingKafkaProperties.ReadyTopicProperties;
import com.example.fanout.processing.config.ProcessingKafkaProperties.TierProperties;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/** application.yml と同じ既定値の設定。 */
public final class TestProperties {

  private TestProperties() {}

  public static ProcessingKafkaProperties kafka() {
    Map<NotificationPriority, TierProperties> tiers = new EnumMap<>(NotificationPriority.class);
    tiers.put(
        NotificationPriority.CRITICAL,
        new TierProperties(
            true, "critical-notifications", "critical-consumer", 3, 3, Duration.ofDays(1)));
    tiers.put(
        NotificationPriority.HIGH,
        new TierProperties(
            true, "high-priority-notifications", "high-priority-consumer", 5, 2, Duration.ofDays(2)));
    tiers.put(
        NotificationPriority.LOW,
        new TierProperties(
            true, "low-priority-notifications", "low-priority-consumer", 2, 1, Duration.ofDays(7)));
    return new ProcessingKafkaProperties(
        "localhost:9092",
        "fanout-processing",
        "latest",
        100,
        Duration.ofSeconds(30),
        Duration.ofSeconds(3),
        Duration.ofMillis(500),
        Duration.ofSeconds(5),
        Duration.ofSeconds(30),
        Duration.ofSeconds(1),
        Duration.ofSeconds(1),
        (short) 1,
        tiers,
        new ReadyTopicProperties("ready-notifications", 5, Duration.ofDays(1)));
  }

  public static AggregationProperties aggregation() {
    return new AggregationProperties(
        Duration.ofSeconds(120), Duration.ofSeconds(10), Duration.ofSeconds(30), 50, 100, true);
  }
}
