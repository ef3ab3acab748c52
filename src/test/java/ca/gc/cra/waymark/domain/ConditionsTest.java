package ca.gc.cra.waymark.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ConditionsTest {

  @Test
  void isPositiveAcceptsOnlyNumbersAboveZero() {
    Condition positive = Conditions.isPositive();
    assertTrue(positive.evaluate(1));
    assertTrue(positive.evaluate(0.25));
    assertTrue(positive.evaluate(new BigDecimal("0.0001")));
    assertFalse(positive.evaluate(0));
    assertFalse(positive.evaluate(-3L));
    assertFalse(positive.evaluate(Double.NaN));
    assertFalse(positive.evaluate("5"));
    assertFalse(positive.evaluate(null));
  }

  @Test
  void isNegativeAcceptsOnlyNumbersBelowZero() {
    Condition negative = Conditions.isNegative();
    assertTrue(negative.evaluate(-1));
    assertTrue(negative.evaluate(-0.5f));
    assertFalse(negative.evaluate(0));
    assertFalse(negative.evaluate(7));
  }

  @Test
  void boundsAreExclusiveAndCompareAcrossNumericTypes() {
    assertTrue(Conditions.greaterThan(0).evaluate(1L));
    assertFalse(Conditions.greaterThan(0).evaluate(0.0));
    assertTrue(Conditions.lesserThan(10).evaluate(9.99));
    assertFalse(Conditions.lesserThan(10).evaluate(10L));
  }

  @Test
  void withinExcludesBothEnds() {
    Condition within = Conditions.within(0, 10);
    assertTrue(within.evaluate(5));
    assertFalse(within.evaluate(0));
    assertFalse(within.evaluate(10));
    assertEquals("Value must be within 0 and 10", within.description());
  }

  @Test
  void boundsCompareStrings() {
    assertTrue(Conditions.greaterThan("b").evaluate("c"));
    assertFalse(Conditions.greaterThan("b").evaluate("a"));
  }

  @Test
  void boundsCompareEnumsAndTimeValuesByNaturalOrder() {
    assertTrue(Conditions.greaterThan(TimeUnit.SECONDS).evaluate(TimeUnit.MINUTES));
    assertFalse(Conditions.greaterThan(TimeUnit.SECONDS).evaluate(TimeUnit.MILLISECONDS));
    assertTrue(Conditions.lesserThan(Duration.ofMinutes(1)).evaluate(Duration.ofSeconds(30)));
    assertTrue(Conditions.within(LocalDate.of(2024, 1, 1), LocalDate.of(2025, 1, 1))
        .evaluate(LocalDate.of(2024, 6, 30)));
  }

  @Test
  void incomparableValuesEvaluateToFalse() {
    assertFalse(Conditions.greaterThan(3).evaluate("text"));
    assertFalse(Conditions.lesserThan("z").evaluate(4));
    assertFalse(Conditions.greaterThan(TimeUnit.SECONDS).evaluate(RoundingMode.UP));
    assertFalse(Conditions.lesserThan(Duration.ofSeconds(1)).evaluate(Instant.EPOCH));
  }

  @Test
  void allowedMatchesEqualValues() {
    Condition allowed = Conditions.allowed("fast", "slow", 3);
    assertTrue(allowed.evaluate("fast"));
    assertTrue(allowed.evaluate(3L));
    assertFalse(allowed.evaluate("medium"));
    assertEquals("Value must be one of the following: [fast, slow, 3]", allowed.description());
  }

  @Test
  void customConditionCarriesDescriptionAndSwallowsPredicateFailures() {
    Condition even = Condition.of("Value must be even", v -> ((Integer) v) % 2 == 0);
    assertTrue(even.evaluate(4));
    assertFalse(even.evaluate(3));
    assertFalse(even.evaluate("four"));
    assertEquals("Value must be even", even.description());
  }
}
