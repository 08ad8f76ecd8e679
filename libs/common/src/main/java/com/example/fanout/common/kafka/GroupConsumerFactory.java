package com.example.fanout.common.kafka;

import org.apache.kafka.clients.consumer.KafkaConsumer;

/** グループ ID ごとに {@link ConsumerFactory} を払い出す。 */
@FunctionalInterface
public interface GroupConsumerFactory {

  ConsumerFactory forGroup(String groupId);

  /** 実ブローカーへ接続する KafkaConsumer を生成するファクトリ。 */
  static GroupConsumerFactory kafka(ConsumerSettings settings) {
    return groupId ->
        instanceName -> new KafkaConsumer<>(settings.toConsumerProperties(groupId, instanceName));
  }
}
