package com.example.fanout.processing.model;

import java.util.Optional;

/**
 * 集約判定の結果。
 *
 * <ul>
 *   <li>SEND_NOW: 集約対象外、またはストア障害で素通しする
 *   <li>ABSORBED: ウィンドウに取り込んだので今は送らない
 *   <li>FLUSHED: 件数上限に達したので集約結果を即時送信する
 * </ul>
 */
public record AggregationDecision(Kind kind, AggregatedNotification aggregate) {

  public enum Kind {
    SEND_NOW,
    ABSORBED,
    FLUSHED
  }

  private static final AggregationDecision SEND_NOW = new AggregationDecision(Kind.SEND_NOW, null);
  private static final AggregationDecision ABSORBED = new AggregationDecision(Kind.ABSORBED, null);

  public static AggregationDecision sendNow() {
    return SEND_NOW;
  }

  public static AggregationDecision absorbed() {
    return ABSORBED;
  }

  public static AggregationDecision flushed(AggregatedNotification aggregate) {
    return new AggregationDecision(Kind.FLUSHED, aggregate);
  }

  public boolean shouldSend() {
    return kind != Kind.ABSORBED;
  }

  public Optional<AggregatedNotification> aggregated() {
    return Optional.ofNullable(aggregate);
  }
}
