package ca.gc.cra.waymark.application;

import ca.gc.cra.waymark.domain.Setting;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Per-host table of values shadowing the registry value of individual settings.
 * <p><strong>Role:</strong> Highest tier of value resolution. Keyed by setting identity; written only through
 * {@link SettingSlot}, which validates values first.</p>
 * <p><strong>Thread-safety:</strong> Methods synchronize on the table.</p>
 *
 * @since 0.1.0
 */
public final class InstanceOverrides {
  private final Map<Setting<?>, Object> values = new IdentityHashMap<>();

  /**
   * Tests whether an override exists for {@code setting}.
   *
   * @param setting setting identity
   * @return {@code true} when overridden on this host
   */
  public synchronized boolean contains(Setting<?> setting) {
    return values.containsKey(setting);
  }

  /**
   * Returns the override for {@code setting}.
   *
   * @param setting setting identity
   * @param <T> value type
   * @return override value, or empty when absent
   */
  @SuppressWarnings("unchecked")
  public synchronized <T> Optional<T> get(Setting<T> setting) {
    return Optional.ofNullable((T) values.get(setting));
  }

  public synchronized int size() {
    return values.size();
  }

  /** Drops every override held by this host. */
  public synchronized void clear() {
    values.clear();
  }

  synchronized <T> void put(Setting<T> setting, T value) {
    values.put(setting, value);
  }

  synchronized boolean remove(Setting<?> setting) {
    if (!values.containsKey(setting)) {
      return false;
    }
    values.remove(setting);
    return true;
  }
}
