package ca.gc.cra.waymark.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class SettingPathTest {

  @Test
  void splitReturnsSegments() {
    assertEquals(List.of("a"), SettingPath.split("a"));
    assertEquals(List.of("server", "http", "port"), SettingPath.split("server.http.port"));
  }

  @Test
  void splitRejectsEmptySegments() {
    assertThrows(IllegalArgumentException.class, () -> SettingPath.split("a."));
    assertThrows(IllegalArgumentException.class, () -> SettingPath.split(".a"));
    assertThrows(IllegalArgumentException.class, () -> SettingPath.split("a..b"));
  }

  @Test
  void isValidNeverThrows() {
    assertTrue(SettingPath.isValid("a.b"));
    assertFalse(SettingPath.isValid(null));
    assertFalse(SettingPath.isValid("a b"));
  }

  @Test
  void joinSkipsEmptyParent() {
    assertEquals("child", SettingPath.join("", "child"));
    assertEquals("parent.child", SettingPath.join("parent", "child"));
  }
}
