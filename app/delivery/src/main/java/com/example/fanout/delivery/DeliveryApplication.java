/*
 * どこで: Delivery アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: チャネル別コンシューマーと DLQ 送信をまとめて起動するため
 */
package com.example.fanout.delivery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

// 共通設定 (Clock/コーデック) は部品としてスキャン対象に含め、スライステストでは除外させる
@SpringBootApplication(
    scanBasePackages = {"com.example.fanout.delivery", "com.example.fanout.common.config"})
@ConfigurationPropertiesScan
public class DeliveryApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeliveryApplication.class, args);
  }
}
