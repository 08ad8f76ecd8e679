package com.example.fanout.common.event;

import java.util.UUID;

public final class EventIds {
  private EventIds() {}

  public static String newEventId() {
    return UUID.randomUUID().toString();
  }
}
