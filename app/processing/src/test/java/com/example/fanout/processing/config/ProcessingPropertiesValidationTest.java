package com.example.fanout.processing.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.fanout.processing.TestProperties;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.time.Duration;
import java.util.Set;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class ProcessingPropertiesValidationTest {

  private static ValidatorFactory factory;
  private static Validator validator;

  @BeforeAll
  static void setUp() {
    factory = Validation.buildDefaultValidatorFactory();
    validator = factory.getValidator();
  }

  @AfterAll
  static void tearDown() {
    factory.close();
  }

  @Test
  void defaultsAreValid() {
    assertThat(validator.validate(TestProperties.kafka())).isEmpty();
    assertThat(validator.validate(TestProperties.aggregation())).isEmpty();
    assertThat(validator.validate(new PreferenceProperties("Asia/Tokyo"))).isEmpty();
  }

  @Test
  void subSecondWindowIsRejected() {
    AggregationProperties properties =
        new AggregationProperties(
            Duration.ofMillis(500), Duration.ofSeconds(10), Duration.ofSeconds(30), 50, 100, true);

    Set<ConstraintViolation<AggregationProperties>> violations = validator.validate(properties);

    assertThat(violations)
        .extracting(ConstraintViolation::getMessage)
        .contains("processing.aggregation.window-duration must be at least 1s");
  }

  @Test
  void nonPositiveBatchSizeIsRejected() {
    AggregationProperties properties =
        new AggregationProperties(
            Duration.ofSeconds(120), Duration.ofSeconds(10), Duration.ofSeconds(30), 0, 100, true);

    assertThat(validator.validate(properties)).isNotEmpty();
  }

  @Test
  void unknownZoneIsRejected() {
    assertThat(validator.validate(new PreferenceProperties("Mars/Olympus")))
        .extracting(ConstraintViolation::getMessage)
        .containsExactly("processing.preferences.zone must be a valid zone id");
  }

  @Test
  void windowTtlAddsBuffer() {
    assertThat(TestProperties.aggregation().windowTtl()).isEqualTo(Duration.ofSeconds(130));
  }
}
