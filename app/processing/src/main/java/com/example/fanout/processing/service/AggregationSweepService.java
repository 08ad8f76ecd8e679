/*
 * どこで: Processing の集約スイープ
 * 何を: 閉じたウィンドウを列挙してフラッシュし、集約結果を ready ストリームへ送る
 * なぜ: 件数上限に届かなかったウィンドウもウィンドウ終了後に 1 通として届けるため
 */
package com.example.fanout.processing.service;

import com.example.fanout.processing.model.AggregatedNotification;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AggregationSweepService {

  private static final Logger logger = LoggerFactory.getLogger(AggregationSweepService.class);

  static final String TRIGGER_SWEEP = "sweep";

  private final AggregationService aggregationService;
  private final NotificationProcessingService processingService;
  private final ProcessingMetrics metrics;

  /** 1 回分のスイープ。送信できた集約の件数を返す。 */
  public int sweep() {
    List<String> windowKeys;
    try {
      windowKeys = aggregationService.closedWindowKeys();
    } catch (RuntimeException ex) {
      metrics.recordStoreError();
      logger.warn("aggregation sweep could not list windows", ex);
      return 0;
    }
    int emitted = 0;
    for (String windowKey : windowKeys) {
      Optional<AggregatedNotification> flushed;
      try {
        flushed = aggregationService.flush(windowKey);
      } catch (RuntimeException ex) {
        metrics.recordStoreError();
        logger.warn("aggregation sweep flush failed windowKey={}", windowKey, ex);
        continue;
      }
      if (flushed.isEmpty()) {
        // 別インスタンスのスイープや上限フラッシュで処理済み
        continue;
      }
      metrics.recordFlush(TRIGGER_SWEEP);
      try {
        processingService.emitAggregate(flushed.get());
        emitted++;
      } catch (RuntimeException ex) {
        // 送信失敗した集約はウィンドウへ戻されており、次のスイープで再送される
        logger.warn(
            "aggregated notification emit failed on sweep windowKey={} count={}",
            windowKey,
            flushed.get().count(),
            ex);
      }
    }
    if (!windowKeys.isEmpty()) {
      logger.info("aggregation sweep finished windows={} emitted={}", windowKeys.size(), emitted);
    }
    return emitted;
  }
}
