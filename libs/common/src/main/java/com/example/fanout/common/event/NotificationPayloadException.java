package com.example.fanout.common.event;

/** 解析できない/必須項目を欠いたペイロード。再処理しても結果は変わらない。 */
public class NotificationPayloadException extends RuntimeException {

  public NotificationPayloadException(String message) {
    super(message);
  }

  public NotificationPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
