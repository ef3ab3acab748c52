package ca.gc.cra.waymark.domain.errors;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a candidate value is not of an allowed type and none of the ordered coercions succeeded.
 *
 * @since 0.1.0
 */
public final class TypeConversionException extends SettingsException {
  private final List<Class<?>> attemptedTypes;

  /**
   * Creates the exception.
   *
   * @param valuePreview printable form of the rejected value
   * @param attemptedTypes allowed types tried, in order
   */
  public TypeConversionException(String valuePreview, List<Class<?>> attemptedTypes) {
    super("Could not convert '" + valuePreview + "' into any of the following types: "
        + attemptedTypes.stream().map(Class::getSimpleName).collect(Collectors.joining(", ", "[", "]")));
    this.attemptedTypes = List.copyOf(attemptedTypes);
  }

  /**
   * Returns the types that conversion was attempted for.
   *
   * @return immutable ordered list
   */
  public List<Class<?>> attemptedTypes() {
    return attemptedTypes;
  }
}
