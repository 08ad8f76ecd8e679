package com.example.fanout.common.event;

/** NotificationEvent.metadata で予約しているキー。 */
public final class MetadataKeys {
  public static final String CHANNELS = "channels";
  public static final String IS_AGGREGATED = "isAggregated";
  public static final String AGGREGATED_COUNT = "aggregatedCount";
  public static final String AGGREGATED_ACTORS = "aggregatedActors";

  private MetadataKeys() {}
}
