package ca.gc.cra.waymark.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.Period;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * Ordered, explicit conversions used when a candidate value is not an instance of an allowed type.
 *
 * <p>Each target type has at most one converter; a converter signals failure by throwing
 * {@link IllegalArgumentException}, {@link ArithmeticException} or a date-time error, which {@link #convert(Object, Class)} maps to an
 * empty result. Integral narrowing is exact: {@code 3.0} converts to {@code Integer 3}, {@code 3.5} does not.
 * Floating-point targets may round a fraction but never overflow a finite source to infinity, and whole numbers
 * convert only when the result holds the same value: {@code 2^53 + 1} does not become a {@code Double}.</p>
 *
 * @since 0.1.0
 */
public final class TypeCoercion {
  private static final Map<Class<?>, Class<?>> BOXES = Map.of(
      int.class, Integer.class, long.class, Long.class, double.class, Double.class, float.class, Float.class,
      boolean.class, Boolean.class, short.class, Short.class, byte.class, Byte.class, char.class, Character.class);

  private static final Map<Class<?>, Function<Object, Object>> CONVERTERS = buildConverters();

  private TypeCoercion() {
    // Utility
  }

  /**
   * Maps primitive classes to their wrappers; other classes are returned unchanged.
   *
   * @param type declared type
   * @return boxed type
   */
  public static Class<?> boxed(Class<?> type) {
    return BOXES.getOrDefault(type, type);
  }

  /**
   * Returns the type a value is declared as when no allowed types are given: the collection interface for JDK
   * collections, the enum class for constants with bodies, {@link Path} for file system paths, otherwise the runtime
   * class.
   *
   * @param value default value
   * @return declared type
   */
  public static Class<?> declaredType(Object value) {
    if (value instanceof List<?>) {
      return List.class;
    }
    if (value instanceof Set<?>) {
      return Set.class;
    }
    if (value instanceof Map<?, ?>) {
      return Map.class;
    }
    if (value instanceof Enum<?> constant) {
      return constant.getDeclaringClass();
    }
    if (value instanceof Path) {
      return Path.class;
    }
    return value.getClass();
  }

  /**
   * Attempts to convert {@code value} into an instance of {@code target}.
   *
   * @param value candidate value; never {@code null}
   * @param target allowed type
   * @return converted value, or empty when no conversion applies or the conversion failed
   */
  public static Optional<Object> convert(Object value, Class<?> target) {
    Class<?> type = boxed(target);
    if (type.isInstance(value)) {
      return Optional.of(value);
    }
    Function<Object, Object> converter = CONVERTERS.get(type);
    try {
      if (converter == null && type.isEnum() && value instanceof String name) {
        return Optional.of(enumConstant(type, name));
      }
      if (converter == null) {
        return Optional.empty();
      }
      Object converted = converter.apply(value);
      return type.isInstance(converted) ? Optional.of(converted) : Optional.empty();
    } catch (IllegalArgumentException | ArithmeticException | NullPointerException | java.time.DateTimeException ex) {
      return Optional.empty();
    }
  }

  private static Object enumConstant(Class<?> type, String name) {
    String trimmed = name.trim();
    String upper = trimmed.toUpperCase(Locale.ROOT);
    Enum<?> caseInsensitive = null;
    for (Object constant : type.getEnumConstants()) {
      Enum<?> candidate = (Enum<?>) constant;
      if (candidate.name().equals(trimmed)) {
        return candidate;
      }
      if (caseInsensitive == null && candidate.name().equals(upper)) {
        caseInsensitive = candidate;
      }
    }
    if (caseInsensitive == null) {
      throw new IllegalArgumentException("no constant " + trimmed + " in " + type.getSimpleName());
    }
    return caseInsensitive;
  }

  private static Map<Class<?>, Function<Object, Object>> buildConverters() {
    Map<Class<?>, Function<Object, Object>> map = new HashMap<>();
    map.put(String.class, TypeCoercion::toText);
    map.put(Integer.class, v -> exact(v).intValueExact());
    map.put(Long.class, v -> exact(v).longValueExact());
    map.put(Short.class, v -> exact(v).shortValueExact());
    map.put(Byte.class, v -> exact(v).byteValueExact());
    map.put(BigInteger.class, v -> exact(v).toBigIntegerExact());
    map.put(BigDecimal.class, TypeCoercion::exact);
    map.put(Double.class, TypeCoercion::toDouble);
    map.put(Float.class, TypeCoercion::toFloat);
    map.put(Boolean.class, TypeCoercion::toBoolean);
    map.put(Character.class, TypeCoercion::toCharacter);
    map.put(Duration.class, v -> Duration.parse(text(v)));
    map.put(Period.class, v -> Period.parse(text(v)));
    map.put(Instant.class, v -> v instanceof OffsetDateTime t ? t.toInstant() : Instant.parse(text(v)));
    map.put(LocalDate.class,
        v -> v instanceof Instant i ? LocalDate.ofInstant(i, ZoneOffset.UTC) : LocalDate.parse(text(v)));
    map.put(LocalTime.class, v -> LocalTime.parse(text(v)));
    map.put(LocalDateTime.class,
        v -> v instanceof Instant i ? LocalDateTime.ofInstant(i, ZoneOffset.UTC) : LocalDateTime.parse(text(v)));
    map.put(OffsetDateTime.class,
        v -> v instanceof Instant i ? i.atOffset(ZoneOffset.UTC) : OffsetDateTime.parse(text(v)));
    map.put(ZonedDateTime.class, v -> ZonedDateTime.parse(text(v)));
    map.put(UUID.class, v -> UUID.fromString(text(v)));
    map.put(URI.class, v -> URI.create(text(v)));
    map.put(Path.class, v -> Path.of(text(v)));
    map.put(List.class, v -> ImmutableValues.freeze(List.copyOf(collection(v))));
    map.put(Set.class, v -> ImmutableValues.freeze(Set.copyOf(collection(v))));
    map.put(Map.class, v -> {
      if (!(v instanceof Map<?, ?> m)) {
        throw new IllegalArgumentException("not a mapping");
      }
      return ImmutableValues.freeze(m);
    });
    return Map.copyOf(map);
  }

  private static Object toText(Object value) {
    if (value instanceof Number || value instanceof Boolean || value instanceof Character
        || value instanceof Enum<?> || value instanceof TemporalAccessor || value instanceof Duration
        || value instanceof Period || value instanceof UUID || value instanceof URI || value instanceof Path) {
      return value.toString();
    }
    throw new IllegalArgumentException("not a scalar");
  }

  private static String text(Object value) {
    if (value instanceof String s) {
      return s.trim();
    }
    throw new IllegalArgumentException("not text");
  }

  private static BigDecimal exact(Object value) {
    if (value instanceof BigDecimal d) {
      return d;
    }
    if (value instanceof BigInteger i) {
      return new BigDecimal(i);
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (!Double.isFinite(d)) {
        throw new ArithmeticException("not finite");
      }
      return BigDecimal.valueOf(d);
    }
    if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return BigDecimal.valueOf(((Number) value).longValue());
    }
    return new BigDecimal(text(value));
  }

  private static Double toDouble(Object value) {
    double converted = value instanceof Number n ? n.doubleValue() : Double.parseDouble(text(value));
    requireFaithful(value, converted);
    return converted;
  }

  private static Float toFloat(Object value) {
    float converted = value instanceof Number n ? n.floatValue() : Float.parseFloat(text(value));
    requireFaithful(value, converted);
    return converted;
  }

  private static void requireFaithful(Object source, double converted) {
    if (!Double.isFinite(converted) && isFinite(source)) {
      throw new ArithmeticException("out of range: " + source);
    }
    if (isIntegral(source) && new BigDecimal(converted).compareTo(exact(source)) != 0) {
      throw new ArithmeticException("not exactly representable: " + source);
    }
  }

  private static boolean isFinite(Object source) {
    if (source instanceof Double || source instanceof Float) {
      return Double.isFinite(((Number) source).doubleValue());
    }
    if (source instanceof String s) {
      return !s.contains("Infinity") && !s.contains("NaN");
    }
    return true;
  }

  private static boolean isIntegral(Object source) {
    return source instanceof Long || source instanceof Integer || source instanceof Short || source instanceof Byte
        || source instanceof BigInteger;
  }

  private static Boolean toBoolean(Object value) {
    String raw = text(value).toLowerCase(Locale.ROOT);
    return switch (raw) {
      case "true" -> Boolean.TRUE;
      case "false" -> Boolean.FALSE;
      default -> throw new IllegalArgumentException("not a boolean: " + raw);
    };
  }

  private static Character toCharacter(Object value) {
    if (value instanceof String s && s.length() == 1) {
      return s.charAt(0);
    }
    throw new IllegalArgumentException("not a single character");
  }

  private static Collection<?> collection(Object value) {
    if (value instanceof Collection<?> c) {
      return c;
    }
    throw new IllegalArgumentException("not a sequence");
  }
}
