package com.example.fanout.ingestion.kafka;

/** ブローカーへの送信が確認応答まで完了しなかった。 */
public class BrokerSendException extends RuntimeException {

  public BrokerSendException(String message, Throwable cause) {
    super(message, cause);
  }
}
