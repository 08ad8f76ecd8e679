package com.example.fanout.processing.kafka;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.fanout.common.kafka.TopicProvisioner;
import com.example.fanout.common.kafka.TopicProvisioningException;
import com.example.fanout.common.kafka.TopicSpec;
import com.example.fanout.processing.TestProperties;
import java.time.Duration;
import java.util.Collection;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProcessingTopicBootstrapTest {

  @Mock private TopicProvisioner provisioner;

  @Test
  void provisionsTierTopicsAndReadyTopic() {
    when(provisioner.ensureTopics(anyCollection())).thenReturn(Set.of("ready-notifications"));

    new ProcessingTopicBootstrap(provisioner, TestProperties.kafka()).ensureTopics();

    @SuppressWarnings("unchecked")
    ArgumentCaptor<Collection<TopicSpec>> captor = ArgumentCaptor.forClass(Collection.class);
    verify(provisioner).ensureTopics(captor.capture());
    assertThat(captor.getValue())
        .containsExactlyInAnyOrder(
            new TopicSpec("critical-notifications", 3, (short) 1, Duration.ofDays(1)),
            new TopicSpec("high-priority-notifications", 5, (short) 1, Duration.ofDays(2)),
            new TopicSpec("low-priority-notifications", 2, (short) 1, Duration.ofDays(7)),
            new TopicSpec("ready-notifications", 5, (short) 1, Duration.ofDays(1)));
  }

  @Test
  void provisioningFailureStopsStartup() {
    when(provisioner.ensureTopics(anyCollection()))
        .thenThrow(new TopicProvisioningException("admin timed out", null));

    ProcessingTopicBootstrap bootstrap =
        new ProcessingTopicBootstrap(provisioner, TestProperties.kafka());

    assertThatThrownBy(bootstrap::ensureTopics)
        .isInstanceOf(IllegalStateException.class)
        .hasCauseInstanceOf(TopicProvisioningException.class);
  }
}
