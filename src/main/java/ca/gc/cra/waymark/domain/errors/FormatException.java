package ca.gc.cra.waymark.domain.errors;

/**
 * Raised when YAML, TOML, or JSON settings text cannot be decoded into a mapping.
 *
 * @since 0.1.0
 */
public final class FormatException extends SettingsException {
  /**
   * Creates the exception.
   *
   * @param message decoder diagnostic
   */
  public FormatException(String message) { super(message); }

  /**
   * Creates the exception with the parser failure attached.
   *
   * @param message decoder diagnostic
   * @param cause parser exception
   */
  public FormatException(String message, Throwable cause) { super(message, cause); }
}
