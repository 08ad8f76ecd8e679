package com.example.fanout.common.event;

import java.util.Locale;

/** 配信チャネル。PUSH は単発送信、EMAIL/SMS はリトライ対象。 */
public enum DeliveryChannel {
  PUSH,
  EMAIL,
  SMS;

  public String topicSuffix() {
    return name().toLowerCase(Locale.ROOT);
  }
}
