/*
 * どこで: Ingestion アプリの Kafka 設定
 * 何を: 取り込み用 Producer を生成する
 * なぜ: ブローカー停止時に送信呼び出しが長時間ブロックしないよう上限を明示するため
 */
package com.example.fanout.ingestion.config;

import java.util.Properties;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class KafkaProducerConfig {

  @Bean(destroyMethod = "close")
  public Producer<String, String> ingestionProducer(IngestionKafkaProperties properties) {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.bootstrapServers());
    props.put(ProducerConfig.CLIENT_ID_CONFIG, properties.clientId());
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, "0");
    // メタデータ取得待ちと送信全体の待ちをどちらも send-timeout 以内に収める
    props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, Long.toString(properties.maxBlock().toMillis()));
    props.put(
        ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, Long.toString(properties.sendTimeout().toMillis()));
    props.put(
        ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG,
        Long.toString(properties.sendTimeout().toMillis()));
    return new KafkaProducer<>(props);
  }
}
