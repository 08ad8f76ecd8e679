package com.example.fanout.common.kafka;

import org.apache.kafka.clients.consumer.Consumer;

/** グループ内インスタンスごとにコンシューマーを生成する。テストでは MockConsumer を返す。 */
@FunctionalInterface
public interface ConsumerFactory {

  Consumer<String, String> create(String instanceName);
}
