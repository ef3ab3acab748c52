package ca.gc.cra.waymark.domain.errors;

/**
 * <strong>What:</strong> Root of the unchecked exceptions raised while declaring, binding, updating, or loading settings.
 * <p><strong>Why:</strong> Lets callers of bulk update and load catch every registry failure with one handler while the
 * subclasses keep the individual failure modes distinguishable.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @since 0.1.0
 */
public class SettingsException extends RuntimeException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public SettingsException(String message) { super(message); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public SettingsException(String message, Throwable cause) { super(message, cause); }
}
