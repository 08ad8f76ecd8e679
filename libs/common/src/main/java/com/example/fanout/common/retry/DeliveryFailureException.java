package com.example.fanout.common.retry;

/**
 * 外部プロバイダ送信の失敗。
 *
 * <p>{@code code} にはネットワーク系エラーコード ({@code ETIMEDOUT} など) やプロバイダ固有コードを、
 * {@code httpStatus} には HTTP ステータスを入れる。どちらも無い場合は null。
 */
public class DeliveryFailureException extends RuntimeException {

  private final String code;
  private final Integer httpStatus;

  public DeliveryFailureException(String message, String code, Integer httpStatus, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.httpStatus = httpStatus;
  }

  public static DeliveryFailureException withCode(String message, String code) {
    return new DeliveryFailureException(message, code, null, null);
  }

  public static DeliveryFailureException withStatus(String message, int httpStatus) {
    return new DeliveryFailureException(message, null, httpStatus, null);
  }

  public String code() {
    return code;
  }

  public Integer httpStatus() {
    return httpStatus;
  }
}
