/*
 * どこで: Processing の集約ウィンドウ管理
 * 何を: 集約対象イベントをウィンドウへ取り込み、件数上限到達時やスイープ時にフラッシュする
 * なぜ: 短時間に集中する同種通知 (いいね等) を 1 通にまとめて受信者への通知量を抑えるため
 */
package com.example.fanout.processing.service;

import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.processing.config.AggregationProperties;
import com.example.fanout.processing.model.AggregatedNotification;
import com.example.fanout.processing.model.AggregationDecision;
import com.example.fanout.processing.model.AggregationKey;
import com.example.fanout.processing.repository.AggregationWindowStore;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AggregationService {

  private static final Logger logger = LoggerFactory.getLogger(AggregationService.class);

  static final String TRIGGER_THRESHOLD = "threshold";

  private final AggregationWindowStore store;
  private final AggregationProperties properties;
  private final ProcessingMetrics metrics;
  private final Clock clock;

  /**
   * イベントをウィンドウに取り込むか判定する。
   *
   * <p>集約対象外の種別はストアに触れず SEND_NOW。ストア障害時も SEND_NOW (fail-open)。
   */
  public AggregationDecision decide(NotificationEvent event) {
    if (event.type() == null || !event.type().isAggregatable()) {
      return AggregationDecision.sendNow();
    }
    if (event.actorId() == null || event.actorId().isBlank()) {
      // アクターで重複排除できないので集約しない
      logger.debug("aggregatable event without actorId, sending now eventId={}", event.id());
      return AggregationDecision.sendNow();
    }
    Instant now = clock.instant();
    AggregationKey key = AggregationKey.of(event, currentWindowId(now));
    try {
      long count = store.addActor(key, event);
      if (count < properties.maxBatchSize()) {
        logger.debug("event absorbed windowKey={} count={}", key.windowKey(), count);
        return AggregationDecision.absorbed();
      }
      Optional<AggregatedNotification> flushed = flush(key.windowKey());
      if (flushed.isEmpty()) {
        // 別ワーカーが先にフラッシュ済み。その集約に含まれている
        return AggregationDecision.absorbed();
      }
      metrics.recordFlush(TRIGGER_THRESHOLD);
      logger.info(
          "aggregation window flushed on threshold windowKey={} count={}",
          key.windowKey(),
          flushed.get().count());
      return AggregationDecision.flushed(flushed.get());
    } catch (RuntimeException ex) {
      metrics.recordStoreError();
      logger.warn(
          "aggregation store error, sending without aggregation eventId={} windowKey={}",
          event.id(),
          key.windowKey(),
          ex);
      return AggregationDecision.sendNow();
    }
  }

  /** ウィンドウを原子的に読み出して削除する。空または既にフラッシュ済みなら empty。 */
  public Optional<AggregatedNotification> flush(String windowKey) {
    return store
        .flush(windowKey)
        .map(snapshot -> AggregatedNotification.from(windowKey, snapshot, clock.instant()));
  }

  /**
   * 送信できなかった集約をウィンドウへ戻す。
   *
   * <p>次の上限フラッシュまたはスイープで、その間に届いたアクターと合わせて 1 通として送られる。
   */
  public void restore(AggregatedNotification aggregate) {
    store.restore(aggregate.windowKey(), aggregate.snapshot());
    logger.warn(
        "aggregation window restored after failed emit windowKey={} count={}",
        aggregate.windowKey(),
        aggregate.count());
  }

  /** 直前のウィンドウ (既に閉じたもの) のキー一覧。 */
  public List<String> closedWindowKeys() {
    return store.findWindowKeys(currentWindowId(clock.instant()) - 1);
  }

  long currentWindowId(Instant now) {
    return AggregationKey.windowIdAt(now, properties.windowDuration());
  }
}
