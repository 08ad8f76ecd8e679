/*
 * どこで: Ingestion アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: 設定クラスとフォールバック回収スケジュールをまとめて有効化するため
 */
package com.example.fanout.ingestion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

// 共通設定 (Clock/コーデック) は部品としてスキャン対象に含め、スライステストでは除外させる
@SpringBootApplication(
    scanBasePackages = {"com.example.fanout.ingestion", "com.example.fanout.common.config"})
@EnableScheduling
@ConfigurationPropertiesScan
public class IngestionApplication {

  public static void main(String[] args) {
    SpringApplication.run(IngestionApplication.class, args);
  }
}
