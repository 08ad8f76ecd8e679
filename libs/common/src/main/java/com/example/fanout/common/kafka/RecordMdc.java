/*
 * どこで: Kafka コンシューマー共通処理
 * 何を: レコード処理中だけ MDC に event_id / target_id / topic / partition / offset を載せる
 * なぜ: 非同期処理のログをレコード単位で追跡できるようにするため
 */
package com.example.fanout.common.kafka;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.MDC;

public final class RecordMdc implements AutoCloseable {

  public static final String EVENT_ID = "event_id";
  public static final String TARGET_ID = "target_id";
  public static final String TOPIC = "topic";
  public static final String PARTITION = "partition";
  public static final String OFFSET = "offset";
  public static final String EVENT_ID_HEADER = "event_id";

  private final List<String> keys = new ArrayList<>();

  private RecordMdc() {}

  public static RecordMdc open(ConsumerRecord<String, String> record) {
    RecordMdc mdc = new RecordMdc();
    mdc.put(TOPIC, record.topic());
    mdc.put(PARTITION, Integer.toString(record.partition()));
    mdc.put(OFFSET, Long.toString(record.offset()));
    // レコードキーは常に targetId
    mdc.put(TARGET_ID, record.key());
    Header eventId = record.headers().lastHeader(EVENT_ID_HEADER);
    if (eventId != null && eventId.value() != null) {
      mdc.put(EVENT_ID, new String(eventId.value(), StandardCharsets.UTF_8));
    }
    return mdc;
  }

  private void put(String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    if (!keys.contains(key)) {
      keys.add(key);
    }
  }

  @Override
  public void close() {
    // 付与したキーだけを外し、スレッドに残さない
    for (String key : keys) {
      MDC.remove(key);
    }
    keys.clear();
  }
}
