package ca.gc.cra.waymark.application;

/**
 * Effective value of a setting together with the tier it came from.
 *
 * @param value effective value
 * @param source precedence tier that supplied the value
 * @param <T> value type
 * @since 0.1.0
 */
public record Resolution<T>(T value, Source source) {
  /** Precedence tiers, highest first. */
  public enum Source {
    /** Value assigned on the host instance. */
    INSTANCE_OVERRIDE,
    /** Registry value; equals the declared default until the setting is updated. */
    REGISTRY
  }
}
