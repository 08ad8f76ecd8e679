/*
 * どこで: Delivery アプリの Kafka 設定
 * 何を: DLQ 送信用 Producer、トピック作成用 Admin、チャネル用コンシューマーファクトリ、再送待機を生成する
 * なぜ: Kafka クライアントと待機処理をここに集め、テストでは差し替えられるようにするため
 */
package com.example.fanout.delivery.config;

import com.example.fanout.common.kafka.GroupConsumerFactory;
import com.example.fanout.common.kafka.TopicProvisioner;
import com.example.fanout.common.retry.RetrySleeper;
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
public class DeliveryKafkaConfig {

  @Bean(destroyMethod = "close")
  public Producer<String, String> deadLetterProducer(DeliveryKafkaProperties properties) {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.bootstrapServers());
    props.put(ProducerConfig.CLIENT_ID_CONFIG, properties.clientId() + "-dlq");
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    long sendTimeoutMs = properties.sendTimeout().toMillis();
    props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, Long.toString(sendTimeoutMs));
    props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, Long.toString(sendTimeoutMs));
    props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, Long.toString(sendTimeoutMs));
    return new KafkaProducer<>(props);
  }

  @Bean(destroyMethod = "close")
  public Admin deliveryAdmin(DeliveryKafkaProperties properties) {
    Properties props = new Properties();
    props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, properties.bootstrapServers());
    props.put(AdminClientConfig.CLIENT_ID_CONFIG, properties.clientId() + "-admin");
    String adminTimeoutMs = Long.toString(properties.adminTimeout().toMillis());
    props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, adminTimeoutMs);
    props.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, adminTimeoutMs);
    return Admin.create(props);
  }

  @Bean
  public TopicProvisioner topicProvisioner(Admin admin, DeliveryKafkaProperties properties) {
    return new TopicProvisioner(admin, properties.adminTimeout());
  }

  @Bean
  public GroupConsumerFactory groupConsumerFactory(DeliveryKafkaProperties properties) {
    return GroupConsumerFactory.kafka(properties.toConsumerSettings());
  }

  @Bean
  public RetrySleeper retrySleeper() {
    // 再送待機はレコード処理スレッド上で行い、途中キャンセルはしない
    return RetrySleeper.uninterruptible();
  }
}
