package com.example.fanout.processing.model;

import com.example.fanout.common.event.NotificationEvent;
import java.time.Instant;
import java.util.List;

/** フラッシュ済みウィンドウ 1 件分の集約結果。count は重複を除いたアクター数。 */
public record AggregatedNotification(
    String windowKey,
    NotificationEvent firstEvent,
    List<String> actorIds,
    List<String> actorNames,
    List<String> actorAvatars,
    int count,
    Instant lastTimestamp) {

  public AggregatedNotification {
    actorIds = List.copyOf(actorIds);
    actorNames = List.copyOf(actorNames);
    actorAvatars = List.copyOf(actorAvatars);
  }

  public static AggregatedNotification from(
      String windowKey, WindowSnapshot snapshot, Instant flushedAt) {
    return new AggregatedNotification(
        windowKey,
        snapshot.firstEvent(),
        snapshot.actorIds(),
        snapshot.actorNames(),
        snapshot.actorAvatars(),
        snapshot.actorIds().size(),
        flushedAt);
  }

  /** ウィンドウへ戻すときの中身。 */
  public WindowSnapshot snapshot() {
    return new WindowSnapshot(actorIds, actorNames, actorAvatars, firstEvent);
  }
}
