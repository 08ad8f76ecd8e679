/*
 * どこで: Processing アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: ティア別コンシューマーと集約スイープ、監査ログ掃除をまとめて起動するため
 */
package com.example.fanout.processing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

// 共通設定 (Clock/コーデック) は部品としてスキャン対象に含め、スライステストでは除外させる
@SpringBootApplication(
    scanBasePackages = {"com.example.fanout.processing", "com.example.fanout.common.config"})
@EnableScheduling
@ConfigurationPropertiesScan
public class ProcessingApplication {

  public static void main(String[] args) {
    SpringApplication.run(ProcessingApplication.class, args);
  }
}
