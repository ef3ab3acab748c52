package ca.gc.cra.waymark.domain.errors;

/**
 * Raised when something other than a {@link ca.gc.cra.waymark.domain.Setting} is inserted into a namespace.
 *
 * @since 0.1.0
 */
public final class NotASettingException extends SettingsException {
  /**
   * Creates the exception for the rejected name.
   *
   * @param name name the value was bound to
   * @param value rejected value type, used only in the message
   */
  public NotASettingException(String name, Object value) {
    super("Only Settings can be inserted in the registry; '" + name + "' was given "
        + (value == null ? "null" : value.getClass().getName()));
  }
}
