package ca.gc.cra.waymark.domain;

import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.Period;
import java.time.Year;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * <strong>What:</strong> Decides whether a value is immutable enough to be held by a {@link Setting}.
 * <p><strong>Why:</strong> Setting values are shared by every reader of the registry; a value that can be changed in
 * place would bypass validation and the no-overwrite rules.</p>
 * <p><strong>Accepted kinds:</strong> boxed primitives, {@link String}, {@link BigInteger}, {@link BigDecimal}, enums,
 * {@link UUID}, {@link URI}, {@link Path}, {@code java.time} value types, records whose components are accepted and readable from this package, and
 * the JDK's unmodifiable collections ({@code List.of}, {@code Set.copyOf}, {@code Map.of}, {@code Collections.empty*},
 * {@code Collections.singleton*}) whose elements are accepted. Arrays, {@code ArrayList}, {@code HashMap} and
 * {@code Collections.unmodifiable*} views are rejected because their content can still change.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 */
public final class ImmutableValues {
  private static final Set<Class<?>> SCALARS = Set.of(
      String.class, Boolean.class, Character.class, Byte.class, Short.class, Integer.class, Long.class,
      Float.class, Double.class, BigInteger.class, BigDecimal.class, UUID.class, URI.class,
      Duration.class, Period.class, Instant.class, LocalDate.class, LocalTime.class, LocalDateTime.class,
      OffsetDateTime.class, OffsetTime.class, ZonedDateTime.class, Year.class, YearMonth.class, MonthDay.class,
      ZoneOffset.class);

  private static final Set<Class<?>> FROZEN_COLLECTIONS = Stream.of(
          List.of(), List.of(1), List.of(1, 2, 3),
          Set.of(), Set.of(1), Set.of(1, 2, 3),
          Map.of(), Map.of(1, 1), Map.of(1, 1, 2, 2),
          Collections.emptyList(), Collections.emptySet(), Collections.emptyMap(),
          Collections.singletonList(1), Collections.singleton(1), Collections.singletonMap(1, 1))
      .map(Object::getClass)
      .collect(Collectors.toUnmodifiableSet());

  private ImmutableValues() {
    // Utility
  }

  /**
   * Tests whether {@code value} may be stored in a setting.
   *
   * @param value candidate value
   * @return {@code true} when the value and everything it contains is immutable
   */
  public static boolean isImmutable(Object value) {
    return rejectionReason(value).isEmpty();
  }

  /**
   * Explains why {@code value} cannot be stored, if it cannot.
   *
   * @param value candidate value
   * @return empty when the value is accepted; otherwise a short reason
   */
  public static Optional<String> rejectionReason(Object value) {
    if (value == null) {
      return Optional.of("null is not a permitted setting value");
    }
    Class<?> type = value.getClass();
    if (SCALARS.contains(type) || value instanceof Enum<?> || value instanceof Path) {
      return Optional.empty();
    }
    if (type.isArray()) {
      return Optional.of("arrays are mutable; use List.of(...)");
    }
    if (type.isRecord()) {
      return recordReason(value);
    }
    if (value instanceof Collection<?> || value instanceof Map<?, ?>) {
      if (!FROZEN_COLLECTIONS.contains(type)) {
        return Optional.of(type.getName() + " is mutable; use List.of, Set.of or Map.of");
      }
      Collection<?> elements = value instanceof Map<?, ?> map
          ? Stream.concat(map.keySet().stream(), map.values().stream()).collect(Collectors.toList())
          : (Collection<?>) value;
      for (Object element : elements) {
        Optional<String> reason = rejectionReason(element);
        if (reason.isPresent()) {
          return Optional.of("element " + reason.get());
        }
      }
      return Optional.empty();
    }
    return Optional.of(type.getName() + " is not a known immutable type");
  }

  /**
   * Converts decoded collections into their unmodifiable equivalents, recursively.
   *
   * <p>Scalars are returned unchanged. Collections containing {@code null} are left as they are and will be
   * rejected by {@link #rejectionReason(Object)}.</p>
   *
   * @param value value produced by a YAML, TOML or JSON decoder
   * @return frozen value
   */
  public static Object freeze(Object value) {
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object element : list) {
        copy.add(freeze(element));
      }
      return copy.contains(null) ? copy : List.copyOf(copy);
    }
    if (value instanceof Set<?> set) {
      Set<Object> copy = new LinkedHashSet<>();
      for (Object element : set) {
        copy.add(freeze(element));
      }
      return copy.contains(null) ? copy : Set.copyOf(copy);
    }
    if (value instanceof Map<?, ?> map) {
      Map<Object, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        copy.put(freeze(entry.getKey()), freeze(entry.getValue()));
      }
      if (copy.containsKey(null) || copy.containsValue(null)) {
        return copy;
      }
      return Map.copyOf(copy);
    }
    return value;
  }

  private static Optional<String> recordReason(Object value) {
    for (RecordComponent component : value.getClass().getRecordComponents()) {
      Object componentValue;
      try {
        componentValue = component.getAccessor().invoke(value);
      } catch (ReflectiveOperationException | RuntimeException ex) {
        return Optional.of("record component '" + component.getName() + "' is not readable: " + ex.getMessage());
      }
      Optional<String> reason = rejectionReason(componentValue);
      if (reason.isPresent()) {
        return Optional.of("record component '" + component.getName() + "': " + reason.get());
      }
    }
    return Optional.empty();
  }
}
