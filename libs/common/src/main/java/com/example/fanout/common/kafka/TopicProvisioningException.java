package com.example.fanout.common.kafka;

public class TopicProvisioningException extends RuntimeException {

  public TopicProvisioningException(String message, Throwable cause) {
    super(message, cause);
  }
}
