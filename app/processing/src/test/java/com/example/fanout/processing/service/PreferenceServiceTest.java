package com.example.fanout.processing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.example.fanout.common.event.NotificationType;
import com.example.fanout.processing.config.PreferenceProperties;
import com.example.fanout.processing.model.NotificationPreference;
import com.example.fanout.processing.repository.PreferenceRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class PreferenceServiceTest {

  // Asia/Tokyo では 23:30
  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T14:30:00Z");

  @Mock private PreferenceRepository repository;

  private PreferenceService service;

  @BeforeEach
  void setUp() {
    service =
        new PreferenceService(
            repository,
            new PreferenceProperties("Asia/Tokyo"),
            new ProcessingMetrics(new SimpleMeterRegistry()),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void missingPreferencesAllowEverything() {
    when(repository.findByUserId("user-1")).thenReturn(Optional.empty());

    assertThat(service.isAllowed("user-1", NotificationType.MARKETING)).isTrue();
  }

  @Test
  void pushDisabledBlocksAllTypes() {
    when(repository.findByUserId("user-1"))
        .thenReturn(Optional.of(preference(false, true, true, false, null, null)));

    assertThat(service.isAllowed("user-1", NotificationType.OTP)).isFalse();
  }

  @Test
  void categoryFlagsGateMarketingAndActivity() {
    when(repository.findByUserId("user-1"))
        .thenReturn(Optional.of(preference(true, false, false, false, null, null)));

    assertThat(service.isAllowed("user-1", NotificationType.MARKETING)).isFalse();
    assertThat(service.isAllowed("user-1", NotificationType.LIKE)).isFalse();
    assertThat(service.isAllowed("user-1", NotificationType.COMMENT)).isFalse();
    assertThat(service.isAllowed("user-1", NotificationType.FOLLOW)).isTrue();
  }

  @Test
  void overnightDndWindowIsEvaluatedInConfiguredZone() {
    when(repository.findByUserId("user-1"))
        .thenReturn(
            Optional.of(
                preference(true, true, true, true, LocalTime.of(22, 0), LocalTime.of(7, 0))));

    assertThat(service.isAllowed("user-1", NotificationType.SECURITY_ALERT)).isFalse();
  }

  @Test
  void dndWithoutBothBoundsIsIgnored() {
    when(repository.findByUserId("user-1"))
        .thenReturn(Optional.of(preference(true, true, true, true, LocalTime.of(22, 0), null)));

    assertThat(service.isAllowed("user-1", NotificationType.LIKE)).isTrue();
  }

  @Test
  void lookupFailureFailsOpen() {
    when(repository.findByUserId("user-1"))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    assertThat(service.isAllowed("user-1", NotificationType.LIKE)).isTrue();
  }

  @Test
  void windowBoundsAreInclusive() {
    LocalTime start = LocalTime.of(14, 0);
    LocalTime end = LocalTime.of(16, 0);

    assertThat(PreferenceService.isWithinWindow(LocalTime.of(14, 0), start, end)).isTrue();
    assertThat(PreferenceService.isWithinWindow(LocalTime.of(16, 0, 59), start, end)).isTrue();
    assertThat(PreferenceService.isWithinWindow(LocalTime.of(16, 1), start, end)).isFalse();
    assertThat(PreferenceService.isWithinWindow(LocalTime.of(13, 59), start, end)).isFalse();
  }

  @Test
  void overnightWindowWrapsMidnight() {
    LocalTime start = LocalTime.of(22, 0);
    LocalTime end = LocalTime.of(8, 0);

    assertThat(PreferenceService.isWithinWindow(LocalTime.of(23, 30), start, end)).isTrue();
    assertThat(PreferenceService.isWithinWindow(LocalTime.of(7, 59), start, end)).isTrue();
    assertThat(PreferenceService.isWithinWindow(LocalTime.NOON, start, end)).isFalse();
  }

  private static NotificationPreference preference(
      boolean pushEnabled,
      boolean marketing,
      boolean activity,
      boolean dndEnabled,
      LocalTime dndStart,
      LocalTime dndEnd) {
    return new NotificationPreference(
        "user-1", pushEnabled, marketing, activity, true, dndEnabled, dndStart, dndEnd);
  }
}
