package ca.gc.cra.waymark.domain;

import ca.gc.cra.waymark.domain.errors.AlreadyBoundException;
import ca.gc.cra.waymark.domain.errors.TypeConversionException;
import ca.gc.cra.waymark.domain.errors.ValidationException;
import ca.gc.cra.waymark.logging.Logs;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> A single named, typed, described and optionally validated configuration cell.
 * <p><strong>Why:</strong> Lets code declare its configuration where it is used while a single registry collects and
 * updates every declaration.</p>
 * <p><strong>Role:</strong> Leaf of the settings tree; bound once into a {@link NamespaceNode} and afterwards changed
 * only through {@link #setValue(Object)}.</p>
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>The current value is an instance of one of {@link #allowedTypes()} and satisfies every condition.</li>
 *   <li>The current value is immutable (see {@link ImmutableValues}).</li>
 *   <li>Allowed types and conditions never change after construction.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The current value is a volatile reference replaced atomically, so concurrent
 * readers always see a complete, validated value. Concurrent writers must be serialized by the caller.</p>
 *
 * @param <T> common supertype of the allowed value types
 * @since 0.1.0
 */
public final class Setting<T> implements TreeEntry {
  private static final Logger log = LoggerFactory.getLogger(Setting.class);

  private final T defaultValue;
  private final String description;
  private final List<Class<?>> allowedTypes;
  private final List<Condition> conditions;
  private final DeclarationSite declaredAt;
  private final ClassLoader declaringLoader;
  private volatile Object currentValue;
  private volatile NamespaceNode parent;
  private volatile String name;

  private Setting(Builder<T> builder, DeclarationSite declaredAt, ClassLoader declaringLoader) {
    this.defaultValue = builder.defaultValue;
    this.description = builder.description;
    this.allowedTypes = builder.allowedTypes.isEmpty()
        ? List.of(TypeCoercion.declaredType(defaultValue))
        : List.copyOf(builder.allowedTypes);
    this.conditions = List.copyOf(builder.conditions);
    this.declaredAt = declaredAt;
    this.declaringLoader = declaringLoader;
    if (allowedTypes.stream().noneMatch(type -> type.isInstance(defaultValue))) {
      throw new IllegalArgumentException("default value " + Logs.preview(defaultValue)
          + " is not an instance of any allowed type " + allowedTypes);
    }
    requireConditions(defaultValue);
    requireImmutable(defaultValue);
    this.currentValue = defaultValue;
  }

  /**
   * Declares a setting whose only allowed type is the runtime class of {@code defaultValue}.
   *
   * @param defaultValue initial and default value; must be immutable
   * @param <T> value type
   * @return new unbound setting
   * @throws ValidationException if the default is mutable
   */
  public static <T> Setting<T> of(T defaultValue) {
    return builder(defaultValue).build();
  }

  /**
   * Declares a described setting validated by {@code conditions}.
   *
   * @param defaultValue initial and default value; must be immutable and satisfy every condition
   * @param description human-readable description, rendered as a comment when the registry is encoded
   * @param conditions validations applied to the default and every later value
   * @param <T> value type
   * @return new unbound setting
   * @throws ValidationException if the default is mutable or fails a condition
   */
  public static <T> Setting<T> of(T defaultValue, String description, Condition... conditions) {
    return builder(defaultValue).description(description).conditions(conditions).build();
  }

  /**
   * Starts a builder for settings that need several allowed types.
   *
   * @param defaultValue initial and default value
   * @param <T> common supertype of the allowed types
   * @return builder
   */
  public static <T> Builder<T> builder(T defaultValue) {
    return new Builder<>(defaultValue);
  }

  /**
   * Returns the declared default.
   *
   * @return default value
   */
  public T defaultValue() {
    return defaultValue;
  }

  /**
   * Returns the registry-level value: the default until a successful {@link #setValue(Object)}.
   *
   * @return current value
   */
  @SuppressWarnings("unchecked")
  public T value() {
    return (T) currentValue;
  }

  public String description() {
    return description;
  }

  /**
   * Returns the allowed types in coercion order.
   *
   * @return immutable list, never empty
   */
  public List<Class<?>> allowedTypes() {
    return allowedTypes;
  }

  public List<Condition> conditions() {
    return conditions;
  }

  /**
   * Returns where this setting was constructed.
   *
   * @return declaration site when it could be determined
   */
  public Optional<DeclarationSite> declaredAt() {
    return Optional.ofNullable(declaredAt);
  }

  /**
   * Tests whether this setting comes from a fresh copy of the class that declared {@code previous}: the same class
   * name, loaded by a different class loader.
   */
  boolean isReloadOf(Setting<?> previous) {
    if (declaredAt == null || previous.declaredAt == null || declaringLoader == previous.declaringLoader) {
      return false;
    }
    return declaredAt.className().equals(previous.declaredAt.className());
  }

  /**
   * Returns the name this setting is bound under.
   *
   * @return name, or empty when the setting has not been bound yet
   */
  public Optional<String> name() {
    return Optional.ofNullable(name);
  }

  @Override
  public Optional<NamespaceNode> parent() {
    return Optional.ofNullable(parent);
  }

  @Override
  public String path() {
    NamespaceNode owner = parent;
    String bound = name;
    return owner == null || bound == null ? "" : owner.qualify(bound);
  }

  /**
   * Replaces the registry-level value after type coercion, condition checks and the immutability check.
   *
   * @param newValue candidate value
   * @throws TypeConversionException if the value is not of an allowed type and cannot be converted to one
   * @throws ValidationException if the value fails a condition or is mutable
   */
  public void setValue(Object newValue) {
    T accepted = check(newValue);
    Object previous = currentValue;
    currentValue = accepted;
    log.debug("Setting {} changed from {} to {}", label(), Logs.preview(previous), Logs.preview(accepted));
  }

  /**
   * Resets the registry-level value to the declared default.
   */
  public void restoreDefault() {
    currentValue = defaultValue;
    log.debug("Setting {} restored to default {}", label(), Logs.preview(defaultValue));
  }

  /**
   * Runs the acceptance pipeline without storing the result.
   *
   * @param candidate candidate value
   * @return the value that {@link #setValue(Object)} would store, possibly coerced
   * @throws TypeConversionException if no allowed type fits
   * @throws ValidationException if a condition fails or the value is mutable
   */
  @SuppressWarnings("unchecked")
  public T check(Object candidate) {
    Object accepted = coerce(candidate);
    requireConditions(accepted);
    requireImmutable(accepted);
    return (T) accepted;
  }

  private Object coerce(Object candidate) {
    if (candidate != null) {
      for (Class<?> type : allowedTypes) {
        if (type.isInstance(candidate)) {
          return candidate;
        }
      }
      for (Class<?> type : allowedTypes) {
        Optional<Object> converted = TypeCoercion.convert(candidate, type);
        if (converted.isPresent()) {
          return converted.get();
        }
      }
    }
    throw new TypeConversionException(Logs.preview(candidate), allowedTypes);
  }

  private void requireConditions(Object value) {
    for (Condition condition : conditions) {
      if (!condition.evaluate(value)) {
        throw new ValidationException(label() + ": " + condition.description()
            + " (was " + Logs.preview(value) + ")");
      }
    }
  }

  private void requireImmutable(Object value) {
    Optional<String> reason = ImmutableValues.rejectionReason(value);
    if (reason.isPresent()) {
      throw new ValidationException(label() + ": setting values must be immutable; " + reason.get());
    }
  }

  synchronized void attach(NamespaceNode owner, String boundName) {
    if (parent != null && (parent != owner || !boundName.equals(name))) {
      throw new AlreadyBoundException(path());
    }
    this.parent = owner;
    this.name = boundName;
  }

  synchronized void detach() {
    this.parent = null;
    this.name = null;
  }

  private String label() {
    String path = path();
    return path.isEmpty() ? "Setting(" + Logs.preview(defaultValue) + ")" : "'" + path + "'";
  }

  @Override
  public String toString() {
    String path = path();
    return "Setting(" + (path.isEmpty() ? "" : path + "=") + Logs.preview(currentValue) + ")";
  }

  /**
   * Builder for {@link Setting}.
   *
   * @param <T> common supertype of the allowed types
   */
  public static final class Builder<T> {
    private final T defaultValue;
    private String description = "";
    private final Set<Class<?>> allowedTypes = new LinkedHashSet<>();
    private final List<Condition> conditions = new ArrayList<>();

    private Builder(T defaultValue) {
      this.defaultValue = Objects.requireNonNull(defaultValue, "defaultValue");
    }

    /**
     * Sets the description.
     *
     * @param description free text; {@code null} is treated as empty
     * @return this builder
     */
    public Builder<T> description(String description) {
      this.description = description == null ? "" : description;
      return this;
    }

    /**
     * Declares the allowed types, in the order coercion tries them.
     *
     * @param types allowed types; primitives are boxed
     * @return this builder
     */
    public Builder<T> allowedTypes(Class<?>... types) {
      for (Class<?> type : types) {
        allowedTypes.add(TypeCoercion.boxed(Objects.requireNonNull(type, "type")));
      }
      return this;
    }

    /**
     * Appends conditions.
     *
     * @param added conditions evaluated in order
     * @return this builder
     */
    public Builder<T> conditions(Condition... added) {
      for (Condition condition : Arrays.asList(added)) {
        conditions.add(Objects.requireNonNull(condition, "condition"));
      }
      return this;
    }

    /**
     * Builds the setting and records its declaration site.
     *
     * @return new unbound setting
     * @throws ValidationException if the default is mutable or fails a condition
     * @throws IllegalArgumentException if the default is not an instance of any declared allowed type
     */
    public Setting<T> build() {
      Optional<StackWalker.StackFrame> caller = DeclarationSite.callerFrame();
      DeclarationSite site = caller.map(DeclarationSite::of).orElse(null);
      ClassLoader loader = caller.map(frame -> frame.getDeclaringClass().getClassLoader()).orElse(null);
      Setting<T> setting = new Setting<>(this, site, loader);
      if (site != null) {
        DeclarationLog.record(site, setting);
      }
      return setting;
    }
  }
}
