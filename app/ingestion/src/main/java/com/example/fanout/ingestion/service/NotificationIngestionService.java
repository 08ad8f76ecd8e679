/*
 * どこで: Ingestion サービス層
 * 何を: 取り込み要求を検証し、ID/時刻/優先度を確定させて優先度別トピックへ送る
 * なぜ: 以降の段が前提とする必須項目とトピック振り分けを入口で保証するため
 */
package com.example.fanout.ingestion.service;

import com.example.fanout.common.event.EventIds;
import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.common.event.NotificationPriority;
import com.example.fanout.ingestion.model.IngestRequest;
import com.example.fanout.ingestion.model.PublishResult;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationIngestionService {

  private final Validator validator;
  private final PriorityTopicResolver topicResolver;
  private final NotificationEventPublisher publisher;
  private final Clock clock;

  /**
   * 要求を 1 件取り込む。
   *
   * @throws ConstraintViolationException 必須項目が欠けている場合
   * @throws EventPublishException Kafka とフォールバック保存の両方に失敗した場合
   */
  public PublishResult ingest(IngestRequest request) {
    Set<ConstraintViolation<IngestRequest>> violations = validator.validate(request);
    if (!violations.isEmpty()) {
      throw new ConstraintViolationException(violations);
    }
    NotificationPriority priority =
        topicResolver.resolvePriority(request.type(), request.priority());
    NotificationEvent event =
        NotificationEvent.builder()
            .id(EventIds.newEventId())
            .type(request.type())
            .priority(priority)
            .actorId(request.actorId())
            .actorName(request.actorName())
            .actorAvatar(request.actorAvatar())
            .targetId(request.targetId())
            .targetType(request.targetType())
            .targetEntityId(request.targetEntityId())
            .title(request.title())
            .message(request.message())
            .imageUrl(request.imageUrl())
            .metadata(request.metadata())
            .timestamp(Instant.now(clock))
            .build();
    return publisher.publish(event, topicResolver.topicFor(priority));
  }
}
