package ca.gc.cra.waymark.infrastructure.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.waymark.application.SettingsRegistry;
import ca.gc.cra.waymark.domain.Setting;
import ca.gc.cra.waymark.domain.errors.FormatException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TomlSettingsCodecTest {
  private final TomlSettingsCodec codec = new TomlSettingsCodec();

  @Test
  void encodeWritesRootSettingsThenTables() {
    String toml = codec.encode(CodecFixtures.sampleRegistry().root());

    assertEquals("""
        a = 3 # Answer
        tags = ["one", "two words"]

        [nested]
        b = "x"
        flag = true # Feature flag
        ratio = 0.5

        [empty]
        """, toml);
  }

  @Test
  void decodeReturnsNestedMapping() {
    Map<String, Object> decoded = codec.decode("""
        a = 3
        [nested]
        b = "x"
        list = [1, 2]
        [nested.deeper]
        day = 2024-01-31
        """);

    assertEquals(Map.of(
        "a", 3L,
        "nested", Map.of("b", "x", "list", List.of(1L, 2L), "deeper", Map.of("day", LocalDate.of(2024, 1, 31)))),
        decoded);
  }

  @Test
  void loadRestoresChangedValuesIntoFreshTree() {
    SettingsRegistry source = CodecFixtures.richRegistry();
    CodecFixtures.changeRichValues(source);
    SettingsRegistry target = CodecFixtures.richRegistry();

    target.load(codec.encode(source.root()), codec);

    assertEquals(source.dump(), target.dump());
  }

  @Test
  void integersNarrowToDeclaredType() {
    SettingsRegistry registry = new SettingsRegistry();
    registry.declare("workers", Setting.of(4));

    registry.load("workers = 16\n", codec);

    assertEquals(Integer.valueOf(16), registry.value("workers"));
  }

  @Test
  void keysNeedingQuotesAreQuoted() {
    SettingsRegistry registry = new SettingsRegistry();
    registry.declare("group.key:with:colons", Setting.of("v"));

    String toml = codec.encode(registry.root());

    assertEquals("[group]\n\"key:with:colons\" = \"v\"\n", toml);
    assertEquals(Map.of("group", Map.of("key:with:colons", "v")), codec.decode(toml));
  }

  @Test
  void nonFiniteFloatsUseTomlSpelling() {
    assertEquals("nan", TomlSettingsCodec.render(Double.NaN));
    assertEquals("-inf", TomlSettingsCodec.render(Double.NEGATIVE_INFINITY));
    assertEquals("{ a = 1 }", TomlSettingsCodec.render(Map.of("a", 1)));
  }

  @Test
  void emptyDocumentDecodesToEmptyMapping() {
    assertTrue(codec.decode("").isEmpty());
  }

  @Test
  void malformedTomlIsAFormatError() {
    FormatException ex = assertThrows(FormatException.class, () -> codec.decode("a = \n[unterminated"));
    assertTrue(ex.getMessage().startsWith("Failed to parse TOML settings"));
  }
}
