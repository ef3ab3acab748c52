package ca.gc.cra.waymark.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.waymark.domain.NamespaceNode;
import ca.gc.cra.waymark.domain.Setting;
import ca.gc.cra.waymark.domain.errors.AlreadyBoundException;
import ca.gc.cra.waymark.domain.errors.FormatException;
import ca.gc.cra.waymark.domain.errors.NotASettingException;
import ca.gc.cra.waymark.domain.errors.PathConflictException;
import ca.gc.cra.waymark.domain.errors.TypeConversionException;
import ca.gc.cra.waymark.domain.errors.UnknownSettingException;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SettingsRegistryTest {
  private SettingsRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new SettingsRegistry();
  }

  @Test
  void declaredSettingsResolveByPath() {
    registry.declare("a", Setting.of(3));
    registry.declare("nested.b", Setting.of("x"));

    assertEquals(3, (Integer) registry.value("a"));
    assertEquals("x", registry.value("nested.b"));
  }

  @Test
  void multiTypeSettingAcceptsStringThroughUpdate() {
    Setting<Object> d = registry.declare("d",
        Setting.<Object>builder(5).allowedTypes(Integer.class, String.class).build());

    registry.update(Map.of("d", "hello"));

    assertEquals("hello", ValueResolver.resolve(d));
  }

  @Test
  void singleTypeSettingRejectsStringThroughUpdate() {
    Setting<Integer> e = registry.declare("e", Setting.of(6));

    assertThrows(TypeConversionException.class, () -> registry.update(Map.of("e", "hello")));
    assertEquals(6, ValueResolver.resolve(e));
  }

  @Test
  void rebindFailsButUpdateChangesValue() {
    Setting<Integer> b = registry.declare("b", Setting.of(3));

    assertThrows(AlreadyBoundException.class, () -> registry.declare("b", Setting.of(5)));
    registry.update(Map.of("b", 5));

    assertEquals(5, ValueResolver.resolve(b));
    assertSame(b, registry.setting("b"));
  }

  @Test
  void bindRejectsPlainValues() {
    assertThrows(NotASettingException.class, () -> registry.bind("plain", "value"));
  }

  @Test
  void settingLookupDistinguishesMissingFromNamespace() {
    registry.namespace("group");

    assertThrows(UnknownSettingException.class, () -> registry.setting("missing"));
    assertThrows(PathConflictException.class, () -> registry.setting("group"));
    assertTrue(registry.lookup("group").orElseThrow() instanceof NamespaceNode);
    assertFalse(registry.lookup("missing").isPresent());
  }

  @Test
  void loadDecodesThenUpdates() {
    registry.declare("server.port", Setting.of(8080));

    int applied = registry.load("ignored", text -> Map.of("server", Map.of("port", 9090)));

    assertEquals(1, applied);
    assertEquals(9090, (Integer) registry.value("server.port"));
  }

  @Test
  void loadPropagatesFormatFailures() {
    registry.declare("a", Setting.of(1));

    assertThrows(FormatException.class, () -> registry.load("bad", text -> {
      throw new FormatException("bad input");
    }));
    assertEquals(1, (Integer) registry.value("a"));
  }

  @Test
  void encodeDelegatesToEncoderWithRoot() {
    registry.declare("a", Setting.of(1));

    assertEquals("1 entries", registry.encode(root -> root.size() + " entries"));
  }

  @Test
  void dumpReturnsNestedValues() {
    registry.declare("a", Setting.of(3));
    registry.declare("nested.b", Setting.of("x"));

    assertEquals(Map.of("a", 3, "nested", Map.of("b", "x")), registry.dump());
  }

  @Test
  void resetDiscardsTreeAndUnbindsSettings() {
    Setting<Integer> a = registry.declare("a", Setting.of(3));
    NamespaceNode before = registry.root();

    registry.reset();

    assertTrue(registry.root().isEmpty());
    assertFalse(before == registry.root());
    assertEquals("", a.path());
    registry.declare("a", Setting.of(4));
    assertEquals(4, (Integer) registry.value("a"));
  }

  @Test
  void globalRegistryIsSingleton() {
    assertSame(SettingsRegistry.global(), SettingsRegistry.global());
    assertFalse(new SettingsRegistry() == SettingsRegistry.global());
  }
}
