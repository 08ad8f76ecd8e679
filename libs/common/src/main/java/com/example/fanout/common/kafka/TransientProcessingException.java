package com.example.fanout.common.kafka;

/** 依存先の一時障害。レコードはコミットせずにパーティションを巻き戻す。 */
public class TransientProcessingException extends RuntimeException {

  public TransientProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
