package ca.gc.cra.waymark.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * <strong>What:</strong> Built-in {@link Condition} factories for bounds and fixed choices.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Sign checks ({@link #isPositive()}, {@link #isNegative()}).</li>
 *   <li>Exclusive bounds ({@link #greaterThan(Comparable)}, {@link #lesserThan(Comparable)},
 *       {@link #within(Comparable, Comparable)}).</li>
 *   <li>Enumerated choices ({@link #allowed(Object...)}).</li>
 * </ul>
 * <p>Numbers compare by value across boxed types, so {@code greaterThan(0)} accepts {@code 1L} and {@code 0.5}.
 * Text, characters, enums of one class, durations, date-time values, paths and UUIDs compare by natural order.
 * Values that cannot be compared with the bound evaluate to {@code false}.</p>
 * <p><strong>Thread-safety:</strong> Returned conditions are immutable.</p>
 *
 * @since 0.1.0
 */
public final class Conditions {
  private static final Condition POSITIVE =
      new Described("Value must be positive", v -> v instanceof Number && compare(v, 0).orElse(0) > 0);
  private static final Condition NEGATIVE =
      new Described("Value must be negative", v -> v instanceof Number && compare(v, 0).orElse(0) < 0);

  private Conditions() {
    // Utility
  }

  /**
   * Accepts numbers strictly greater than zero.
   *
   * @return shared condition instance
   */
  public static Condition isPositive() {
    return POSITIVE;
  }

  /**
   * Accepts numbers strictly lesser than zero.
   *
   * @return shared condition instance
   */
  public static Condition isNegative() {
    return NEGATIVE;
  }

  /**
   * Accepts values strictly greater than {@code low}.
   *
   * @param low exclusive lower bound
   * @return condition closed over {@code low}
   */
  public static Condition greaterThan(Comparable<?> low) {
    Objects.requireNonNull(low, "low");
    return new Described("Value must be greater than " + low, v -> compare(v, low).orElse(0) > 0);
  }

  /**
   * Accepts values strictly lesser than {@code high}.
   *
   * @param high exclusive upper bound
   * @return condition closed over {@code high}
   */
  public static Condition lesserThan(Comparable<?> high) {
    Objects.requireNonNull(high, "high");
    return new Described("Value must be lesser than " + high, v -> compare(v, high).orElse(0) < 0);
  }

  /**
   * Accepts values strictly between {@code low} and {@code high}.
   *
   * @param low exclusive lower bound
   * @param high exclusive upper bound
   * @return condition closed over both bounds
   */
  public static Condition within(Comparable<?> low, Comparable<?> high) {
    Condition above = greaterThan(low);
    Condition below = lesserThan(high);
    return new Described("Value must be within " + low + " and " + high,
        v -> above.evaluate(v) && below.evaluate(v));
  }

  /**
   * Accepts values equal to one of {@code values}.
   *
   * @param values permitted values; numbers match by numeric value
   * @return condition closed over a copy of {@code values}
   */
  public static Condition allowed(Object... values) {
    List<Object> choices = Arrays.asList(values.clone());
    return new Described("Value must be one of the following: " + choices,
        v -> choices.stream().anyMatch(choice -> sameValue(v, choice)));
  }

  static boolean sameValue(Object left, Object right) {
    if (left instanceof Number && right instanceof Number) {
      return compare(left, right).map(c -> c == 0).orElse(false);
    }
    return Objects.equals(left, right);
  }

  static Optional<Integer> compare(Object left, Object right) {
    if (left == null || right == null) {
      return Optional.empty();
    }
    if (left instanceof Number l && right instanceof Number r) {
      if (Double.isNaN(l.doubleValue()) || Double.isNaN(r.doubleValue())) {
        return Optional.empty();
      }
      Optional<BigDecimal> a = decimal(l);
      Optional<BigDecimal> b = decimal(r);
      if (a.isPresent() && b.isPresent()) {
        return Optional.of(a.get().compareTo(b.get()));
      }
      return Optional.of(Double.compare(l.doubleValue(), r.doubleValue()));
    }
    if (left instanceof Enum<?> a && right instanceof Enum<?> b) {
      return a.getDeclaringClass() == b.getDeclaringClass()
          ? Optional.of(Integer.compare(a.ordinal(), b.ordinal()))
          : Optional.empty();
    }
    return compareAs(String.class, left, right)
        .or(() -> compareAs(Character.class, left, right))
        .or(() -> compareAs(Boolean.class, left, right))
        .or(() -> compareAs(Duration.class, left, right))
        .or(() -> compareAs(Instant.class, left, right))
        .or(() -> compareAs(LocalDate.class, left, right))
        .or(() -> compareAs(LocalTime.class, left, right))
        .or(() -> compareAs(LocalDateTime.class, left, right))
        .or(() -> compareAs(OffsetDateTime.class, left, right))
        .or(() -> compareAs(ZonedDateTime.class, left, right))
        .or(() -> compareAs(Path.class, left, right))
        .or(() -> compareAs(UUID.class, left, right));
  }

  private static <C extends Comparable<? super C>> Optional<Integer> compareAs(
      Class<C> type, Object left, Object right) {
    if (type.isInstance(left) && type.isInstance(right)) {
      return Optional.of(type.cast(left).compareTo(type.cast(right)));
    }
    return Optional.empty();
  }

  private static Optional<BigDecimal> decimal(Number number) {
    if (number instanceof BigDecimal d) {
      return Optional.of(d);
    }
    if (number instanceof BigInteger i) {
      return Optional.of(new BigDecimal(i));
    }
    if (number instanceof Double || number instanceof Float) {
      double d = number.doubleValue();
      return Double.isFinite(d) ? Optional.of(BigDecimal.valueOf(d)) : Optional.empty();
    }
    if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
      return Optional.of(BigDecimal.valueOf(number.longValue()));
    }
    try {
      return Optional.of(new BigDecimal(number.toString()));
    } catch (NumberFormatException ex) {
      return Optional.empty();
    }
  }

  /** Condition with a fixed description; predicate failures count as rejection. */
  record Described(String description, Predicate<Object> test) implements Condition {
    @Override
    public boolean evaluate(Object value) {
      try {
        return test.test(value);
      } catch (RuntimeException ex) {
        return false;
      }
    }

    @Override
    public String toString() {
      return description;
    }
  }
}
