package ca.gc.cra.waymark.domain.errors;

/**
 * Raised when a second, distinct setting is bound to a name that already holds one.
 *
 * @since 0.1.0
 */
public final class AlreadyBoundException extends SettingsException {
  private final String path;

  /**
   * Creates the exception for the bound path.
   *
   * @param path qualified path of the existing setting
   */
  public AlreadyBoundException(String path) {
    super("Entry '" + path + "' already in the registry; use update or load to change its value");
    this.path = path;
  }

  /**
   * Returns the qualified path that is already bound.
   *
   * @return dotted path
   */
  public String path() {
    return path;
  }
}
