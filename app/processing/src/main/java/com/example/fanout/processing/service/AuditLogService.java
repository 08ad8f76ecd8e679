/*
 * どこで: Processing の監査ログ
 * 何を: 処理結果 (SENT/FILTERED_PREFS/FAILED) を別スレッドで notification_audit_log に書く
 * なぜ: 監査ログの遅延や障害をパイプライン本体に波及させないため
 */
package com.example.fanout.processing.service;

import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.processing.config.AuditLogProperties;
import com.example.fanout.processing.model.AuditLogEntry;
import com.example.fanout.processing.model.AuditStatus;
import com.example.fanout.processing.repository.AuditLogRepository;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class AuditLogService {

  private static final Logger logger = LoggerFactory.getLogger(AuditLogService.class);

  private final AuditLogRepository repository;
  private final AuditLogProperties properties;
  private final ProcessingMetrics metrics;
  private final Clock clock;
  private final ExecutorService executor;
  private final AtomicReference<Instant> suppressedUntil = new AtomicReference<>(Instant.MIN);

  @Autowired
  public AuditLogService(
      AuditLogRepository repository,
      AuditLogProperties properties,
      ProcessingMetrics metrics,
      Clock clock) {
    this(repository, properties, metrics, clock, newExecutor(properties.queueCapacity()));
  }

  @VisibleForTesting
  AuditLogService(
      AuditLogRepository repository,
      AuditLogProperties properties,
      ProcessingMetrics metrics,
      Clock clock,
      ExecutorService executor) {
    this.repository = repository;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.executor = executor;
  }

  /** 呼び出し元をブロックせず、失敗も伝えない。 */
  public void log(NotificationEvent event, AuditStatus status) {
    if (!properties.enabled()) {
      return;
    }
    Instant now = clock.instant();
    if (now.isBefore(suppressedUntil.get())) {
      metrics.recordAuditDropped();
      return;
    }
    AuditLogEntry entry =
        new AuditLogEntry(
            UUID.randomUUID().toString(),
            event.id(),
            event.targetId(),
            event.type(),
            status,
            now,
            now.plus(properties.retention()));
    try {
      executor.execute(() -> write(entry));
    } catch (RejectedExecutionException ex) {
      metrics.recordAuditDropped();
      logger.debug("audit log queue full, dropping eventId={} status={}", event.id(), status);
    }
  }

  @Scheduled(fixedDelayString = "${processing.audit.purge-interval}")
  public void purgeExpired() {
    if (!properties.enabled()) {
      return;
    }
    try {
      int deleted = repository.deleteExpired(clock.instant());
      if (deleted > 0) {
        logger.info("expired audit log entries purged count={}", deleted);
      }
    } catch (DataAccessException ex) {
      logger.warn("audit log purge failed", ex);
    }
  }

  @VisibleForTesting
  boolean isSuppressed() {
    return clock.instant().isBefore(suppressedUntil.get());
  }

  @PreDestroy
  public void shutdown() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(
          properties.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn("audit log executor did not drain within grace, dropping remaining entries");
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }

  private void write(AuditLogEntry entry) {
    try {
      repository.insert(entry);
    } catch (DataAccessException ex) {
      // 障害中に書き込みを繰り返さないよう一定時間スキップする
      suppressedUntil.set(clock.instant().plus(properties.suppressAfterFailure()));
      metrics.recordAuditDropped();
      logger.warn(
          "audit log write failed, suppressing for {}ms eventId={} status={}",
          properties.suppressAfterFailure().toMillis(),
          entry.eventId(),
          entry.status(),
          ex);
    }
  }

  private static ExecutorService newExecutor(int queueCapacity) {
    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(queueCapacity),
        new ThreadFactoryBuilder().setNameFormat("audit-log-%d").setDaemon(true).build(),
        new ThreadPoolExecutor.AbortPolicy());
  }
}
