package com.example.fanout.processing.service;

/** ready トピックへの送信失敗。呼び出し元はレコードを再処理する。 */
public class ReadyPublishException extends RuntimeException {

  public ReadyPublishException(String message, Throwable cause) {
    super(message, cause);
  }
}
