package com.example.fanout.processing.kafka;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.common.event.NotificationEventCodec;
import com.example.fanout.common.event.NotificationPriority;
import com.example.fanout.common.kafka.TransientProcessingException;
import com.example.fanout.processing.TestEvents;
import com.example.fanout.processing.model.ProcessingOutcome;
import com.example.fanout.processing.service.NotificationProcessingService;
import com.example.fanout.processing.service.ProcessingMetrics;
import com.example.fanout.processing.service.ReadyPublishException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationRecordHandlerTest {

  private static final String TOPIC = "high-priority-notifications";

  @Mock private NotificationProcessingService processingService;

  private final NotificationEventCodec codec = TestEvents.codec();
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private NotificationRecordHandler handler;

  @BeforeEach
  void setUp() {
    handler =
        new NotificationRecordHandler(
            NotificationPriority.HIGH, codec, processingService, new ProcessingMetrics(meterRegistry));
  }

  @Test
  void decodedEventIsProcessedUnderItsTier() {
    when(processingService.process(any(NotificationEvent.class), eq(NotificationPriority.HIGH)))
        .thenReturn(ProcessingOutcome.ABSORBED);

    handler.handle(record(codec.encode(TestEvents.like("evt-1", "a"))));

    ArgumentCaptor<NotificationEvent> captor = ArgumentCaptor.forClass(NotificationEvent.class);
    verify(processingService).process(captor.capture(), eq(NotificationPriority.HIGH));
    assertThat(captor.getValue().id()).isEqualTo("evt-1");
    assertThat(captor.getValue().actorId()).isEqualTo("a");
  }

  @Test
  void malformedPayloadIsSkippedAndCounted() {
    handler.handle(record("{not json"));
    handler.handle(record("{\"type\":\"LIKE\"}"));

    verifyNoInteractions(processingService);
    assertThat(meterRegistry.get("processing.payload.invalid.total").counter().count())
        .isEqualTo(2.0);
  }

  @Test
  void readyPublishFailureBecomesTransient() {
    when(processingService.process(any(NotificationEvent.class), eq(NotificationPriority.HIGH)))
        .thenThrow(new ReadyPublishException("ready down", null));

    assertThatThrownBy(() -> handler.handle(record(codec.encode(TestEvents.otp("evt-2")))))
        .isInstanceOf(TransientProcessingException.class)
        .hasMessageContaining("evt-2")
        .hasCauseInstanceOf(ReadyPublishException.class);
  }

  private static ConsumerRecord<String, String> record(String value) {
    return new ConsumerRecord<>(TOPIC, 0, 12L, "user-1", value);
  }
}
