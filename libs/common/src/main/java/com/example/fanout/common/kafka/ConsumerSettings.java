/*
 * どこで: Kafka コンシューマー共通処理
 * 何を: コンシューマーグループ実行に必要な接続/ポーリング設定をまとめる
 * なぜ: 処理段と配信段で同じ Kafka クライアント設定の組み立てを共有するため
 */
package com.example.fanout.common.kafka;

import java.time.Duration;
import java.util.Properties;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;

public record ConsumerSettings(
    String bootstrapServers,
    String clientId,
    String autoOffsetReset,
    int maxPollRecords,
    Duration sessionTimeout,
    Duration heartbeatInterval,
    Duration pollTimeout,
    Duration transientBackoff,
    Duration shutdownGrace) {

  /** 手動コミット前提のコンシューマー設定を組み立てる。 */
  public Properties toConsumerProperties(String groupId, String instanceName) {
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
    props.put(ConsumerConfig.CLIENT_ID_CONFIG, clientId + "-" + instanceName);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    // 処理完了後にだけコミットする (at-least-once)
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, autoOffsetReset);
    props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, Integer.toString(maxPollRecords));
    props.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, Long.toString(sessionTimeout.toMillis()));
    props.put(
        ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, Long.toString(heartbeatInterval.toMillis()));
    return props;
  }
}
