package ca.gc.cra.waymark.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.waymark.application.SettingsRegistry;
import ca.gc.cra.waymark.domain.Setting;
import ca.gc.cra.waymark.infrastructure.format.SettingsFormat;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WaymarkTest {
  private SettingsRegistry registry;

  @BeforeEach
  void setUp() {
    SettingsRegistry.global().reset();
    registry = new SettingsRegistry();
    registry.declare("server.port", Setting.of(8080));
  }

  @AfterEach
  void tearDown() {
    SettingsRegistry.global().reset();
  }

  @Test
  void declareBindsIntoGlobalRegistry() {
    Setting<Integer> port = Waymark.declare("app.port", Setting.of(80));

    assertSame(SettingsRegistry.global(), Waymark.registry());
    assertSame(port, Waymark.registry().setting("app.port"));
  }

  @Test
  void loadTextAndDumpUseGlobalRegistry() {
    Waymark.declare("app.name", Setting.of("demo", "Application name"));

    Waymark.load("app:\n  name: waymark\n", SettingsFormat.YAML);

    assertEquals("waymark", Waymark.registry().value("app.name"));
    assertEquals("[app]\nname = \"waymark\" # Application name\n", Waymark.dump(SettingsFormat.TOML));
  }

  @Test
  void loadPathInfersFormat(@TempDir Path tempDir) throws IOException {
    Waymark.declare("app.workers", Setting.of(2));
    Path file = tempDir.resolve("app.json");
    Files.writeString(file, "{\"app\": {\"workers\": 6}}", StandardCharsets.UTF_8);

    assertEquals(1, Waymark.load(file));
    assertEquals(6, (Integer) Waymark.registry().value("app.workers"));
  }

  @Test
  void systemPropertyNamesSettingsFile(@TempDir Path tempDir) throws IOException {
    Path file = write(tempDir.resolve("prop.yaml"), "server:\n  port: 9000\n");
    Properties properties = new Properties();
    properties.setProperty(Waymark.SETTINGS_FILE_PROPERTY, file.toString());

    Optional<Path> loaded = Waymark.loadFromEnvironment(registry, Map.of(), properties);

    assertEquals(Optional.of(file), loaded);
    assertEquals(9000, (Integer) registry.value("server.port"));
  }

  @Test
  void environmentVariableIsUsedWhenPropertyAbsent(@TempDir Path tempDir) throws IOException {
    Path file = write(tempDir.resolve("env.toml"), "[server]\nport = 9100\n");

    Waymark.loadFromEnvironment(registry, Map.of(Waymark.SETTINGS_FILE_ENV, file.toString()), new Properties());

    assertEquals(9100, (Integer) registry.value("server.port"));
  }

  @Test
  void systemPropertyWinsOverEnvironment(@TempDir Path tempDir) throws IOException {
    Path fromProperty = write(tempDir.resolve("prop.yaml"), "server:\n  port: 9200\n");
    Path fromEnv = write(tempDir.resolve("env.yaml"), "server:\n  port: 9300\n");
    Properties properties = new Properties();
    properties.setProperty(Waymark.SETTINGS_FILE_PROPERTY, fromProperty.toString());

    Waymark.loadFromEnvironment(registry, Map.of(Waymark.SETTINGS_FILE_ENV, fromEnv.toString()), properties);

    assertEquals(9200, (Integer) registry.value("server.port"));
  }

  @Test
  void missingOrUnconfiguredFileKeepsDefaults(@TempDir Path tempDir) throws IOException {
    Properties properties = new Properties();
    properties.setProperty(Waymark.SETTINGS_FILE_PROPERTY, tempDir.resolve("absent.yaml").toString());

    assertTrue(Waymark.loadFromEnvironment(registry, Map.of(), properties).isEmpty());
    assertTrue(Waymark.loadFromEnvironment(registry, Map.of(Waymark.SETTINGS_FILE_ENV, "  "), new Properties())
        .isEmpty());
    assertEquals(8080, (Integer) registry.value("server.port"));
  }

  private static Path write(Path file, String content) throws IOException {
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }
}
