package ca.gc.cra.waymark.domain;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * <strong>What:</strong> Pure predicate a candidate setting value must satisfy before it is accepted.
 * <p><strong>Role:</strong> Validation hook attached to a {@link Setting}; a setting ANDs its conditions in
 * declaration order.</p>
 * <p><strong>Contract:</strong> {@link #evaluate(Object)} is total, side-effect free and deterministic. Values the
 * condition cannot judge evaluate to {@code false}; implementations must not throw.</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable and safe to share.</p>
 *
 * @since 0.1.0
 * @see Conditions
 */
@FunctionalInterface
public interface Condition {
  /**
   * Tests a candidate value.
   *
   * @param value candidate value, already coerced to one of the setting's allowed types
   * @return {@code true} when the value is acceptable
   */
  boolean evaluate(Object value);

  /**
   * Human-readable statement of what the condition requires, used in validation failures.
   *
   * @return description, e.g. {@code "Value must be positive"}
   */
  default String description() {
    return "Value must satisfy " + getClass().getSimpleName();
  }

  /**
   * Wraps a predicate with a description.
   *
   * @param description requirement text quoted in failures
   * @param predicate test; exceptions thrown by it are treated as a failed evaluation
   * @return named condition
   */
  static Condition of(String description, Predicate<Object> predicate) {
    Objects.requireNonNull(description, "description");
    Objects.requireNonNull(predicate, "predicate");
    return new Conditions.Described(description, predicate);
  }
}
