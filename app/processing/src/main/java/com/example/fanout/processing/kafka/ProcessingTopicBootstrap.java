/*
 * どこで: Processing アプリ起動時
 * 何を: 3 ティアのトピックと ready トピックを作成する
 * なぜ: コンシューマー購読前にパーティション数/保持期間を揃え、作れない場合は起動を止めるため
 */
package com.example.fanout.processing.kafka;

import com.example.fanout.common.kafka.TopicProvisioner;
import com.example.fanout.common.kafka.TopicProvisioningException;
import com.example.fanout.common.kafka.TopicSpec;
import com.example.fanout.processing.config.ProcessingKafkaProperties;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ProcessingTopicBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(ProcessingTopicBootstrap.class);

  private final TopicProvisioner provisioner;
  private final ProcessingKafkaProperties properties;

  @PostConstruct
  public void ensureTopics() {
    List<TopicSpec> specs = new ArrayList<>();
    properties
        .tiers()
        .values()
        .forEach(tier -> specs.add(tier.toTopicSpec(properties.replicationFactor())));
    specs.add(properties.ready().toTopicSpec(properties.replicationFactor()));
    try {
      Set<String> created = provisioner.ensureTopics(specs);
      logger.info("processing topics ready created={} total={}", created, specs.size());
    } catch (TopicProvisioningException ex) {
      throw new IllegalStateException("failed to provision processing topics", ex);
    }
  }
}
