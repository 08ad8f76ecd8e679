/*
 * どこで: Processing のイベント処理本体
 * 何を: 設定フィルタ → 集約判定 → チャネル決定 → ready 送信 → 監査ログ を 1 イベントずつ同期で行う
 * なぜ: 送信完了を確認してからオフセットを進め、at-least-once を保つため
 */
package com.example.fanout.processing.service;

import com.example.fanout.common.event.DeliveryChannel;
import com.example.fanout.common.event.MetadataKeys;
import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.common.event.NotificationPriority;
import com.example.fanout.processing.model.AggregatedNotification;
import com.example.fanout.processing.model.AggregationDecision;
import com.example.fanout.processing.model.AuditStatus;
import com.example.fanout.processing.model.ProcessingOutcome;
import com.google.common.base.Strings;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationProcessingService {

  private static final Logger logger =
      LoggerFactory.getLogger(NotificationProcessingService.class);

  private final PreferenceService preferenceService;
  private final AggregationService aggregationService;
  private final ChannelSelector channelSelector;
  private final AggregatedMessageFormatter formatter;
  private final ReadyEventPublisher readyPublisher;
  private final AuditLogService auditLogService;
  private final ProcessingMetrics metrics;

  /**
   * 1 イベントを処理する。
   *
   * @param tier 受信したティア (メトリクス用)
   * @throws ReadyPublishException ready トピックへの送信に失敗した場合。レコードは再処理される
   */
  public ProcessingOutcome process(NotificationEvent event, NotificationPriority tier) {
    if (!preferenceService.isAllowed(event.targetId(), event.type())) {
      auditLogService.log(event, AuditStatus.FILTERED_PREFS);
      metrics.recordOutcome(tier, ProcessingOutcome.FILTERED);
      logger.debug("filtered by preferences eventId={} type={}", event.id(), event.type());
      return ProcessingOutcome.FILTERED;
    }

    AggregationDecision decision = aggregationService.decide(event);
    if (!decision.shouldSend()) {
      metrics.recordOutcome(tier, ProcessingOutcome.ABSORBED);
      return ProcessingOutcome.ABSORBED;
    }

    ProcessingOutcome outcome =
        decision.kind() == AggregationDecision.Kind.FLUSHED
            ? ProcessingOutcome.AGGREGATED_SENT
            : ProcessingOutcome.SENT;
    Optional<AggregatedNotification> aggregate = decision.aggregated();
    NotificationEvent finalEvent = aggregate.map(this::toAggregatedEvent).orElse(event);
    try {
      emit(finalEvent, event);
    } catch (ReadyPublishException ex) {
      aggregate.ifPresent(flushed -> restoreWindow(flushed, ex));
      throw ex;
    }
    metrics.recordOutcome(tier, outcome);
    return outcome;
  }

  /**
   * スイープでフラッシュした集約を送信する。
   *
   * @throws ReadyPublishException 送信に失敗した場合。集約はウィンドウへ戻され次のスイープで再送される
   */
  public void emitAggregate(AggregatedNotification aggregate) {
    NotificationEvent finalEvent = toAggregatedEvent(aggregate);
    try {
      emit(finalEvent, finalEvent);
    } catch (ReadyPublishException ex) {
      restoreWindow(aggregate, ex);
      throw ex;
    }
    metrics.recordOutcome(finalEvent.effectivePriority(), ProcessingOutcome.AGGREGATED_SENT);
  }

  NotificationEvent toAggregatedEvent(AggregatedNotification aggregate) {
    NotificationEvent first = aggregate.firstEvent();
    String firstName = aggregate.actorNames().isEmpty() ? null : aggregate.actorNames().get(0);
    Map<String, Object> metadata = new LinkedHashMap<>(first.metadata());
    metadata.put(MetadataKeys.IS_AGGREGATED, true);
    metadata.put(MetadataKeys.AGGREGATED_COUNT, aggregate.count());
    metadata.put(MetadataKeys.AGGREGATED_ACTORS, aggregate.actorIds());
    return first.toBuilder()
        .message(formatter.message(first.type(), firstName, aggregate.count()))
        .title(formatter.title(first.type(), aggregate.count()))
        .actorId(aggregate.actorIds().isEmpty() ? first.actorId() : aggregate.actorIds().get(0))
        .actorName(firstName)
        .actorAvatar(
            aggregate.actorAvatars().isEmpty()
                ? null
                : Strings.emptyToNull(aggregate.actorAvatars().get(0)))
        .timestamp(aggregate.lastTimestamp())
        .metadata(metadata)
        .build();
  }

  private void restoreWindow(AggregatedNotification aggregate, ReadyPublishException failure) {
    try {
      aggregationService.restore(aggregate);
    } catch (RuntimeException ex) {
      failure.addSuppressed(ex);
      logger.error(
          "aggregated notification lost: emit failed and window could not be restored"
              + " windowKey={} count={}",
          aggregate.windowKey(),
          aggregate.count(),
          ex);
    }
  }

  private void emit(NotificationEvent finalEvent, NotificationEvent source) {
    List<DeliveryChannel> channels = channelSelector.channelsFor(finalEvent.effectivePriority());
    NotificationEvent withChannels =
        finalEvent.withMetadata(
            MetadataKeys.CHANNELS, channels.stream().map(DeliveryChannel::name).toList());
    try {
      readyPublisher.publish(withChannels);
    } catch (ReadyPublishException ex) {
      metrics.recordEmitFailure();
      auditLogService.log(source, AuditStatus.FAILED);
      throw ex;
    }
    auditLogService.log(withChannels, AuditStatus.SENT);
    logger.debug(
        "event sent to ready stream eventId={} type={} channels={}",
        withChannels.id(),
        withChannels.type(),
        channels);
  }
}
