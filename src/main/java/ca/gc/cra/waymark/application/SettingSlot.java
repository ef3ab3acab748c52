package ca.gc.cra.waymark.application;

import ca.gc.cra.waymark.domain.Setting;
import ca.gc.cra.waymark.domain.SettingPath;
import ca.gc.cra.waymark.domain.errors.AlreadyBoundException;
import ca.gc.cra.waymark.domain.errors.TypeConversionException;
import ca.gc.cra.waymark.domain.errors.ValidationException;
import ca.gc.cra.waymark.logging.Logs;
import ca.gc.cra.waymark.validation.Names;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Class-level setting exposed as a per-instance overridable attribute.
 * <p><strong>Why:</strong> A class declares its configuration once, as a static field, and individual instances can
 * still specialise it without touching the value every other instance reads.</p>
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * final class Downloader implements OverridableHost {
 *   static final SettingSlot<Integer> RETRIES =
 *       SettingSlot.declare(Downloader.class, "retries", Setting.of(3, "Retry attempts", Conditions.isPositive()));
 *
 *   private final InstanceOverrides overrides = new InstanceOverrides();
 *
 *   public InstanceOverrides settingOverrides() { return overrides; }
 *
 *   int retries() { return RETRIES.get(this); }
 * }
 * }</pre>
 * The setting is bound at {@code <package>.<Class>.<name>}, for example {@code com.acme.Downloader.retries}.</p>
 * <p><strong>Thread-safety:</strong> Reads are safe; writes to one host's overrides are serialized by its table.</p>
 *
 * @param <T> value type
 * @since 0.1.0
 */
public final class SettingSlot<T> {
  private static final Logger log = LoggerFactory.getLogger(SettingSlot.class);

  private final Setting<T> setting;
  private final String path;

  private SettingSlot(Setting<T> setting, String path) {
    this.setting = setting;
    this.path = path;
  }

  /**
   * Declares a class-level setting in the global registry.
   *
   * @param owner declaring class
   * @param name attribute name
   * @param setting setting to bind
   * @param <T> value type
   * @return slot bound to {@code setting}
   * @throws AlreadyBoundException if a setting is already bound at the same path, unless it was declared by an
   *     earlier copy of the same class under another class loader
   */
  public static <T> SettingSlot<T> declare(Class<?> owner, String name, Setting<T> setting) {
    return declare(SettingsRegistry.global(), owner, name, setting);
  }

  /**
   * Declares a class-level setting in {@code registry}.
   *
   * @param registry registry to bind into
   * @param owner declaring class
   * @param name attribute name
   * @param setting setting to bind
   * @param <T> value type
   * @return slot bound to {@code setting}
   * @throws AlreadyBoundException if a setting is already bound at the same path, unless it was declared by an
   *     earlier copy of the same class under another class loader
   */
  public static <T> SettingSlot<T> declare(SettingsRegistry registry, Class<?> owner, String name,
      Setting<T> setting) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(setting, "setting");
    String path = SettingPath.join(ownerPath(owner), Names.requireSegment(name));
    registry.root().redeclare(path, setting);
    return new SettingSlot<>(setting, path);
  }

  /**
   * Derives the namespace path for a class: its package followed by its (possibly nested) class name.
   *
   * @param owner declaring class
   * @return dotted path, e.g. {@code com.acme.Outer.Inner}
   */
  public static String ownerPath(Class<?> owner) {
    Objects.requireNonNull(owner, "owner");
    String packageName = owner.getPackageName();
    String binaryName = owner.getName();
    String simple = packageName.isEmpty() ? binaryName : binaryName.substring(packageName.length() + 1);
    return SettingPath.join(packageName, simple.replace('$', Names.SEPARATOR));
  }

  public Setting<T> setting() {
    return setting;
  }

  /**
   * Returns the path the setting was declared at.
   *
   * @return dotted path
   */
  public String path() {
    return path;
  }

  /**
   * Reads the registry value, as the class itself sees it.
   *
   * @return registry value
   */
  public T get() {
    return ValueResolver.resolve(setting);
  }

  /**
   * Reads the effective value for {@code host}.
   *
   * @param host instance reading the attribute
   * @return host override when present, otherwise the registry value
   */
  public T get(OverridableHost host) {
    return ValueResolver.resolve(setting, overridesOf(host));
  }

  /**
   * Assigns a value on {@code host} only. The registry value is untouched.
   *
   * @param host instance assigning the attribute
   * @param value new value, validated like {@link Setting#setValue(Object)}
   * @throws AlreadyBoundException if {@code value} is itself a setting
   * @throws TypeConversionException if the value has no allowed type
   * @throws ValidationException if the value fails a condition or is mutable
   */
  public void set(OverridableHost host, Object value) {
    InstanceOverrides overrides = overridesOf(host);
    if (value instanceof Setting<?>) {
      throw new AlreadyBoundException(path);
    }
    T accepted = setting.check(value);
    overrides.put(setting, accepted);
    log.debug("Instance override of {} set to {}", path, Logs.preview(accepted));
  }

  /**
   * Removes the override held by {@code host}.
   *
   * @param host instance owning the override
   * @throws NoSuchElementException if {@code host} has no override for this setting
   */
  public void clear(OverridableHost host) {
    if (!overridesOf(host).remove(setting)) {
      throw new NoSuchElementException("No instance override for " + path);
    }
  }

  /**
   * Tests whether {@code host} overrides this setting.
   *
   * @param host instance to inspect
   * @return {@code true} when an override exists
   */
  public boolean isOverridden(OverridableHost host) {
    return overridesOf(host).contains(setting);
  }

  private static InstanceOverrides overridesOf(OverridableHost host) {
    Objects.requireNonNull(host, "host");
    return Objects.requireNonNull(host.settingOverrides(), "settingOverrides");
  }

  @Override
  public String toString() {
    return "SettingSlot(" + path + ")";
  }
}
