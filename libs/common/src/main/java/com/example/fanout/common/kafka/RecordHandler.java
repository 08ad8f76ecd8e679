package com.example.fanout.common.kafka;

import org.apache.kafka.clients.consumer.ConsumerRecord;

/**
 * 1 レコード分の処理。
 *
 * <p>{@link TransientProcessingException} を投げるとオフセットを進めずに同じレコードを再配信させる。
 * それ以外の例外はログに残してスキップする。
 */
@FunctionalInterface
public interface RecordHandler {

  void handle(ConsumerRecord<String, String> record);
}
