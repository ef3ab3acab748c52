package ca.gc.cra.waymark.domain.errors;

/**
 * Raised when an update or load names a path that was never declared. Updates never create settings.
 *
 * @since 0.1.0
 */
public final class UnknownSettingException extends SettingsException {
  private final String path;

  /**
   * Creates the exception.
   *
   * @param path dotted path that could not be resolved
   */
  public UnknownSettingException(String path) {
    super("Setting '" + path + "' could not be found in the registry");
    this.path = path;
  }

  /**
   * Returns the unresolved path.
   *
   * @return dotted path
   */
  public String path() {
    return path;
  }
}
