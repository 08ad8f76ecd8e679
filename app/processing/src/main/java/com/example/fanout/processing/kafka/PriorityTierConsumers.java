/*
 * どこで: Processing のティア別コンシューマー起動
 * 何を: CRITICAL/HIGH/LOW ごとに独立したコンシューマーグループを設定の並列数で起動/停止する
 * なぜ: 低優先度の滞留が高優先度の処理を遅らせないようにするため
 */
package com.example.fanout.processing.kafka;

import com.example.fanout.common.event.NotificationEventCodec;
import com.example.fanout.common.event.NotificationPriority;
import com.example.fanout.common.kafka.ConsumerGroupRunner;
import com.example.fanout.common.kafka.GroupConsumerFactory;
import com.example.fanout.processing.config.ProcessingKafkaProperties;
import com.example.fanout.processing.config.ProcessingKafkaProperties.TierProperties;
import com.example.fanout.processing.service.NotificationProcessingService;
import com.example.fanout.processing.service.ProcessingMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "processing.kafka.consumers-enabled",
    havingValue = "true",
    matchIfMissing = true)
@DependsOn("processingTopicBootstrap")
@RequiredArgsConstructor
public class PriorityTierConsumers {

  private static final Logger logger = LoggerFactory.getLogger(PriorityTierConsumers.class);

  private final ProcessingKafkaProperties properties;
  private final GroupConsumerFactory consumerFactory;
  private final NotificationEventCodec codec;
  private final NotificationProcessingService processingService;
  private final ProcessingMetrics metrics;
  private final List<ConsumerGroupRunner> runners = new ArrayList<>();

  @PostConstruct
  public void start() {
    for (NotificationPriority tier : NotificationPriority.values()) {
      TierProperties tierProperties = properties.tiers().get(tier);
      if (tierProperties == null || !tierProperties.enabled()) {
        logger.info("tier consumer disabled tier={}", tier);
        continue;
      }
      ConsumerGroupRunner runner =
          new ConsumerGroupRunner(
              tierProperties.groupId(),
              tierProperties.topic(),
              tierProperties.concurrency(),
              consumerFactory.forGroup(tierProperties.groupId()),
              new NotificationRecordHandler(tier, codec, processingService, metrics),
              properties.toConsumerSettings());
      runner.start();
      runners.add(runner);
    }
  }

  @PreDestroy
  public void stop() {
    // 高優先度から順に止める
    for (ConsumerGroupRunner runner : runners) {
      runner.stop();
    }
    runners.clear();
  }

  /** 起動中のグループ名と並列数。 */
  public Map<String, Integer> runningGroups() {
    Map<String, Integer> groups = new LinkedHashMap<>();
    for (ConsumerGroupRunner runner : runners) {
      if (runner.isRunning()) {
        groups.put(runner.groupName(), runner.concurrency());
      }
    }
    return Collections.unmodifiableMap(groups);
  }
}
