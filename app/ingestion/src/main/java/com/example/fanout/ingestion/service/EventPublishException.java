package com.example.fanout.ingestion.service;

/** ブローカー送信とフォールバック保存の両方に失敗した。イベントは保存されていない。 */
public class EventPublishException extends RuntimeException {

  public EventPublishException(String message, Throwable cause) {
    super(message, cause);
  }
}
