package com.example.fanout.common.event;

/** Kafka レコードに付与するヘッダー名。 */
public final class NotificationHeaders {
  public static final String PRIORITY = "priority";
  public static final String TYPE = "type";
  public static final String CHANNEL = "channel";

  private NotificationHeaders() {}
}
