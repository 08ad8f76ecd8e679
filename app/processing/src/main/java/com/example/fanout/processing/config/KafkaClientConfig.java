/*
 * どこで: Processing アプリの Kafka 設定
 * 何を: ready 送信用 Producer、トピック作成用 Admin、ティア用コンシューマーファクトリを生成する
 * なぜ: Kafka クライアントの生成をここに集め、テストではモックに差し替えられるようにするため
 */
package com.example.fanout.processing.config;

import com.example.fanout.common.kafka.GroupConsumerFactory;
import com.example.fanout.common.kafka.TopicProvisioner;
import java.util.Properties;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class KafkaClientConfig {

  @Bean(destroyMethod = "close")
  public Producer<String, String> readyProducer(ProcessingKafkaProperties properties) {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.bootstrapServers());
    props.put(ProducerConfig.CLIENT_ID_CONFIG, properties.clientId() + "-ready");
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, "0");
    // 送信待ちがポーリング間隔を食い潰さないよう send-timeout で打ち切る
    long sendTimeoutMs = properties.sendTimeout().toMillis();
    props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, Long.toString(sendTimeoutMs));
    props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, Long.toString(sendTimeoutMs));
    props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, Long.toString(sendTimeoutMs));
    return new KafkaProducer<>(props);
  }

  @Bean(destroyMethod = "close")
  public Admin processingAdmin(ProcessingKafkaProperties properties) {
    Properties props = new Properties();
    props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, properties.bootstrapServers());
    props.put(AdminClientConfig.CLIENT_ID_CONFIG, properties.clientId() + "-admin");
    String adminTimeoutMs = Long.toString(properties.adminTimeout().toMillis());
    props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, adminTimeoutMs);
    props.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, adminTimeoutMs);
    return Admin.create(props);
  }

  @Bean
  public TopicProvisioner topicProvisioner(Admin admin, ProcessingKafkaProperties properties) {
    return new TopicProvisioner(admin, properties.adminTimeout());
  }

  @Bean
  public GroupConsumerFactory groupConsumerFactory(ProcessingKafkaProperties properties) {
    return GroupConsumerFactory.kafka(properties.toConsumerSettings());
  }
}
