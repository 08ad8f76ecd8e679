package com.example.fanout.ingestion.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.common.event.NotificationPriority;
import com.example.fanout.common.event.NotificationType;
import com.example.fanout.common.event.TargetType;
import com.example.fanout.ingestion.config.IngestionKafkaProperties;
import com.example.fanout.ingestion.model.IngestRequest;
import com.example.fanout.ingestion.model.PublishResult;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validation;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationIngestionServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T00:00:00Z");
  private static final IngestionKafkaProperties KAFKA =
      new IngestionKafkaProperties(
          "localhost:9092",
          "fanout-ingestion",
          Duration.ofSeconds(5),
          Duration.ofSeconds(3),
          new IngestionKafkaProperties.Topics(
              "critical-notifications", "high-priority-notifications", "low-priority-notifications"));

  @Mock private NotificationEventPublisher publisher;

  private NotificationIngestionService service;

  @BeforeEach
  void setUp() {
    service =
        new NotificationIngestionService(
            Validation.buildDefaultValidatorFactory().getValidator(),
            new PriorityTopicResolver(KAFKA),
            publisher,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void assignsIdTimestampAndDefaultPriorityTopic() {
    when(publisher.publish(any(), anyString()))
        .thenReturn(new PublishResult("id", "critical-notifications", NotificationPriority.CRITICAL, false));

    service.ingest(
        IngestRequest.builder()
            .type(NotificationType.PASSWORD_RESET)
            .actorId("system")
            .targetId("user-1")
            .targetType(TargetType.USER)
            .build());

    ArgumentCaptor<NotificationEvent> captor = ArgumentCaptor.forClass(NotificationEvent.class);
    verify(publisher).publish(captor.capture(), eq("critical-notifications"));
    NotificationEvent event = captor.getValue();
    assertThat(event.id()).isNotBlank();
    assertThat(event.priority()).isEqualTo(NotificationPriority.CRITICAL);
    assertThat(event.timestamp()).isEqualTo(FIXED_NOW);
    assertThat(event.targetType()).isEqualTo(TargetType.USER);
  }

  @Test
  void explicitPriorityOverridesTypeDefault() {
    when(publisher.publish(any(), anyString()))
        .thenReturn(new PublishResult("id", "low-priority-notifications", NotificationPriority.LOW, false));

    service.ingest(
        IngestRequest.builder()
            .type(NotificationType.LIKE)
            .actorId("actor-1")
            .targetId("user-1")
            .priority(NotificationPriority.LOW)
            .metadata(Map.of("source", "batch"))
            .build());

    ArgumentCaptor<NotificationEvent> captor = ArgumentCaptor.forClass(NotificationEvent.class);
    verify(publisher).publish(captor.capture(), eq("low-priority-notifications"));
    assertThat(captor.getValue().metadata()).containsEntry("source", "batch");
  }

  @Test
  void rejectsRequestWithoutTarget() {
    IngestRequest request =
        IngestRequest.builder().type(NotificationType.FOLLOW).actorId("actor-1").build();

    assertThatThrownBy(() -> service.ingest(request))
        .isInstanceOf(ConstraintViolationException.class)
        .hasMessageContaining("targetId");
    verifyNoInteractions(publisher);
  }
}
