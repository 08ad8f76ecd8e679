package com.example.fanout.ingestion.service;

import com.example.fanout.ingestion.model.FallbackStats;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/** ブローカー健全性とフォールバック滞留を actuator に公開する。不健全でも取り込みは継続できるので DOWN にはしない。 */
@Component("broker")
@RequiredArgsConstructor
public class BrokerHealthIndicator implements HealthIndicator {

  static final Status DEGRADED = new Status("DEGRADED", "Kafka unavailable, using fallback store");

  private final BrokerHealthTracker healthTracker;
  private final FallbackRecoveryService recoveryService;

  @Override
  public Health health() {
    Health.Builder builder = healthTracker.isHealthy() ? Health.up() : Health.status(DEGRADED);
    healthTracker.lastFailureAt().ifPresent(at -> builder.withDetail("lastFailureAt", at.toString()));
    try {
      FallbackStats stats = recoveryService.stats();
      builder
          .withDetail("fallbackPending", stats.pending())
          .withDetail("fallbackFailed", stats.failed())
          .withDetail("fallbackProcessed", stats.processed());
    } catch (DataAccessException ex) {
      builder.withDetail("fallbackStatsError", ex.getMessage());
    }
    return builder.build();
  }
}
