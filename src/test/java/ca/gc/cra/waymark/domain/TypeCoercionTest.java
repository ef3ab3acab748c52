package ca.gc.cra.waymark.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class TypeCoercionTest {

  @Test
  void integralConversionIsExact() {
    assertEquals(Optional.of(3), TypeCoercion.convert(3L, Integer.class));
    assertEquals(Optional.of(3), TypeCoercion.convert(3.0, int.class));
    assertEquals(Optional.of(42L), TypeCoercion.convert("42", Long.class));
    assertTrue(TypeCoercion.convert(3.5, Integer.class).isEmpty());
    assertTrue(TypeCoercion.convert(Long.MAX_VALUE, Integer.class).isEmpty());
    assertTrue(TypeCoercion.convert("hello", Integer.class).isEmpty());
  }

  @Test
  void numbersAndScalarsConvertToText() {
    assertEquals(Optional.of("5"), TypeCoercion.convert(5, String.class));
    assertEquals(Optional.of("true"), TypeCoercion.convert(true, String.class));
    assertTrue(TypeCoercion.convert(List.of(1), String.class).isEmpty());
  }

  @Test
  void floatingPointAndDecimalConversions() {
    assertEquals(Optional.of(2.0), TypeCoercion.convert(2, Double.class));
    assertEquals(Optional.of(0.5), TypeCoercion.convert("0.5", Double.class));
    assertEquals(Optional.of(new BigDecimal("1.25")), TypeCoercion.convert("1.25", BigDecimal.class));
  }

  @Test
  void floatingPointTargetsRejectOverflow() {
    assertTrue(TypeCoercion.convert(1e300, Float.class).isEmpty());
    assertTrue(TypeCoercion.convert("1e300", float.class).isEmpty());
    assertTrue(TypeCoercion.convert(new BigDecimal("1e400"), Double.class).isEmpty());
    assertEquals(Optional.of(0.1f), TypeCoercion.convert(0.1, Float.class));
    assertEquals(Optional.of(Float.POSITIVE_INFINITY),
        TypeCoercion.convert(Double.POSITIVE_INFINITY, Float.class));
  }

  @Test
  void wholeNumbersConvertToFloatingPointOnlyWhenExact() {
    assertEquals(Optional.of(9007199254740992.0), TypeCoercion.convert(9007199254740992L, Double.class));
    assertTrue(TypeCoercion.convert(9007199254740993L, Double.class).isEmpty());
    assertTrue(TypeCoercion.convert(BigInteger.TEN.pow(400), Double.class).isEmpty());
    assertEquals(Optional.of(16777216f), TypeCoercion.convert(16777216, Float.class));
    assertTrue(TypeCoercion.convert(16777217, Float.class).isEmpty());
  }

  @Test
  void booleansAcceptOnlyTrueAndFalse() {
    assertEquals(Optional.of(Boolean.TRUE), TypeCoercion.convert("TRUE", Boolean.class));
    assertEquals(Optional.of(Boolean.FALSE), TypeCoercion.convert("false", boolean.class));
    assertTrue(TypeCoercion.convert("yes", Boolean.class).isEmpty());
    assertTrue(TypeCoercion.convert(1, Boolean.class).isEmpty());
  }

  @Test
  void textParsesIntoValueTypes() {
    assertEquals(Optional.of(Duration.ofSeconds(30)), TypeCoercion.convert("PT30S", Duration.class));
    assertEquals(Optional.of(LocalDate.of(2024, 1, 31)), TypeCoercion.convert("2024-01-31", LocalDate.class));
    assertEquals(Optional.of(Path.of("var", "log")), TypeCoercion.convert("var/log", Path.class));
    assertTrue(TypeCoercion.convert("not-a-date", LocalDate.class).isEmpty());
  }

  @Test
  void offsetDateTimeConvertsToInstant() {
    OffsetDateTime time = OffsetDateTime.parse("2024-05-01T10:15:30Z");
    assertEquals(Optional.of(Instant.parse("2024-05-01T10:15:30Z")), TypeCoercion.convert(time, Instant.class));
  }

  @Test
  void enumsConvertByNameIgnoringCase() {
    assertEquals(Optional.of(TimeUnit.SECONDS), TypeCoercion.convert("seconds", TimeUnit.class));
    assertEquals(Optional.of(TimeUnit.DAYS), TypeCoercion.convert(" DAYS ", TimeUnit.class));
    assertTrue(TypeCoercion.convert("fortnights", TimeUnit.class).isEmpty());
  }

  @Test
  void collectionsConvertToFrozenCopies() {
    Object list = TypeCoercion.convert(new LinkedHashSet<>(List.of(1, 2)), List.class).orElseThrow();
    assertEquals(List.of(1, 2), list);
    assertThrows(UnsupportedOperationException.class, () -> ((List<?>) list).add(null));
    assertEquals(Optional.of(Set.of("a", "b")), TypeCoercion.convert(List.of("a", "b"), Set.class));
    assertTrue(TypeCoercion.convert(Arrays.asList(1, null), List.class).isEmpty());
    assertTrue(TypeCoercion.convert("a,b", List.class).isEmpty());
    assertTrue(TypeCoercion.convert(List.of(1), Map.class).isEmpty());
  }

  @Test
  void instancesOfTheTargetPassThroughUnchanged() {
    List<Integer> mutable = new ArrayList<>(List.of(1));
    assertSame(mutable, TypeCoercion.convert(mutable, List.class).orElseThrow());
  }

  @Test
  void declaredTypeUsesCollectionInterfaces() {
    assertEquals(List.class, TypeCoercion.declaredType(List.of(1, 2, 3)));
    assertEquals(Map.class, TypeCoercion.declaredType(Map.of()));
    assertEquals(Path.class, TypeCoercion.declaredType(Path.of("a")));
    assertEquals(TimeUnit.class, TypeCoercion.declaredType(TimeUnit.DAYS));
    assertEquals(Integer.class, TypeCoercion.declaredType(7));
  }

  @Test
  void boxedMapsPrimitives() {
    assertEquals(Integer.class, TypeCoercion.boxed(int.class));
    assertEquals(String.class, TypeCoercion.boxed(String.class));
  }
}
