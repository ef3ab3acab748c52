package ca.gc.cra.waymark.application;

import ca.gc.cra.waymark.domain.Setting;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Computes the effective value of a setting by precedence: instance override, then registry
 * value, then declared default.
 * <p><strong>Why:</strong> Hosts can specialise a class-level setting for one instance without touching what every
 * other reader sees.</p>
 * <p><strong>Role:</strong> Read path behind {@link SettingSlot#get(OverridableHost)} and
 * {@link SettingsRegistry#value(String)}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; reads a volatile setting value and a synchronized override table.</p>
 *
 * @implNote The default is never looked up separately: it is the registry value until the first successful update.
 * @since 0.1.0
 */
public final class ValueResolver {
  private ValueResolver() {}

  /**
   * Resolves a setting with no host instance.
   *
   * @param setting setting to read
   * @param <T> value type
   * @return registry value
   */
  public static <T> T resolve(Setting<T> setting) {
    return Objects.requireNonNull(setting, "setting").value();
  }

  /**
   * Resolves a setting as seen by a host instance.
   *
   * @param setting setting to read
   * @param overrides host's override table; {@code null} means no host
   * @param <T> value type
   * @return override when present, otherwise the registry value
   */
  public static <T> T resolve(Setting<T> setting, InstanceOverrides overrides) {
    return explain(setting, overrides).value();
  }

  /**
   * Resolves a setting and reports which tier supplied the value.
   *
   * @param setting setting to read
   * @param overrides host's override table; {@code null} means no host
   * @param <T> value type
   * @return value and source tier
   */
  public static <T> Resolution<T> explain(Setting<T> setting, InstanceOverrides overrides) {
    Objects.requireNonNull(setting, "setting");
    if (overrides != null) {
      Optional<T> override = overrides.get(setting);
      if (override.isPresent()) {
        return new Resolution<>(override.get(), Resolution.Source.INSTANCE_OVERRIDE);
      }
    }
    return new Resolution<>(setting.value(), Resolution.Source.REGISTRY);
  }
}
