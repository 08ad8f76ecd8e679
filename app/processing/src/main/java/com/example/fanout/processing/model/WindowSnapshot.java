package com.example.fanout.processing.model;

import com.example.fanout.common.event.NotificationEvent;
import java.util.List;

/** フラッシュ時にストアから取り出したウィンドウの中身。actorIds は初回到着順。 */
public record WindowSnapshot(
    List<String> actorIds,
    List<String> actorNames,
    List<String> actorAvatars,
    NotificationEvent firstEvent) {

  public WindowSnapshot {
    actorIds = List.copyOf(actorIds);
    actorNames = List.copyOf(actorNames);
    actorAvatars = List.copyOf(actorAvatars);
  }
}
