package ca.gc.cra.waymark.domain.errors;

/**
 * Raised when a value fails a condition or is of a mutable kind.
 *
 * @since 0.1.0
 */
public final class ValidationException extends SettingsException {
  /**
   * Creates the exception.
   *
   * @param message failing condition and value
   */
  public ValidationException(String message) { super(message); }
}
