package ca.gc.cra.waymark.domain.errors;

/**
 * Raised when a path mixes up namespaces and settings: descending through a setting, binding a setting over a
 * namespace, or assigning a plain value where a namespace lives.
 *
 * @since 0.1.0
 */
public final class PathConflictException extends SettingsException {
  private final String path;

  /**
   * Creates the exception.
   *
   * @param path qualified path where the conflict was found
   * @param detail what was expected at that path
   */
  public PathConflictException(String path, String detail) {
    super("Path conflict at '" + path + "': " + detail);
    this.path = path;
  }

  /**
   * Returns the conflicting path.
   *
   * @return dotted path
   */
  public String path() {
    return path;
  }
}
