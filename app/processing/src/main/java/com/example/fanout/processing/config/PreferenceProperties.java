package com.example.fanout.processing.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import java.time.DateTimeException;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** DND 時間帯を評価するタイムゾーン。 */
@ConfigurationProperties(prefix = "processing.preferences")
@Validated
public record PreferenceProperties(@NotBlank String zone) {

  @AssertTrue(message = "processing.preferences.zone must be a valid zone id")
  public boolean isZoneValid() {
    if (zone == null) {
      return true;
    }
    try {
      ZoneId.of(zone);
      return true;
    } catch (DateTimeException ex) {
      return false;
    }
  }

  public ZoneId zoneId() {
    return ZoneId.of(zone);
  }
}
