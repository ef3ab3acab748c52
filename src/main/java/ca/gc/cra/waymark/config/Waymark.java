package ca.gc.cra.waymark.config;

import ca.gc.cra.waymark.application.SettingsRegistry;
import ca.gc.cra.waymark.domain.Setting;
import ca.gc.cra.waymark.infrastructure.format.SettingsFormat;
import ca.gc.cra.waymark.infrastructure.io.SettingsFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Entry point wiring the global registry to the file codecs.
 * <p><strong>Settings file discovery:</strong> {@link #loadFromEnvironment()} reads the file named by the
 * {@value #SETTINGS_FILE_PROPERTY} system property, falling back to the {@value #SETTINGS_FILE_ENV} environment
 * variable. The system property wins when both are set.</p>
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * static final Setting<Integer> PORT = Waymark.declare("server.port", Setting.of(8080, "Listen port"));
 *
 * public static void main(String[] args) throws IOException {
 *   Waymark.loadFromEnvironment();
 *   ...
 * }
 * }</pre>
 * </p>
 *
 * @since 0.1.0
 */
public final class Waymark {
  /** System property naming a settings file to load at startup. */
  public static final String SETTINGS_FILE_PROPERTY = "waymark.settings.file";
  /** Environment variable naming a settings file to load at startup. */
  public static final String SETTINGS_FILE_ENV = "WAYMARK_SETTINGS_FILE";

  private static final Logger log = LoggerFactory.getLogger(Waymark.class);

  private Waymark() {}

  /**
   * Returns the process-wide registry.
   *
   * @return global registry
   */
  public static SettingsRegistry registry() {
    return SettingsRegistry.global();
  }

  /**
   * Binds a setting in the global registry.
   *
   * @param path dotted path from the root
   * @param setting setting to bind
   * @param <T> value type
   * @return {@code setting}
   */
  public static <T> Setting<T> declare(String path, Setting<T> setting) {
    return registry().declare(path, setting);
  }

  /**
   * Loads a settings file into the global registry, inferring its format.
   *
   * @param path settings file
   * @return number of settings updated
   * @throws IOException if the file cannot be read
   */
  public static int load(Path path) throws IOException {
    return SettingsFiles.load(path, registry());
  }

  /**
   * Loads settings text into the global registry.
   *
   * @param text document text
   * @param format document format
   * @return number of settings updated
   */
  public static int load(String text, SettingsFormat format) {
    Objects.requireNonNull(format, "format");
    return registry().load(text, format.codec());
  }

  /**
   * Renders the global registry.
   *
   * @param format document format
   * @return document text
   */
  public static String dump(SettingsFormat format) {
    Objects.requireNonNull(format, "format");
    return registry().encode(format.codec());
  }

  /**
   * Loads the settings file named by the system property or environment variable, if any.
   *
   * @return the file loaded, or empty when none is configured or the file does not exist
   * @throws IOException if the file exists but cannot be read
   */
  public static Optional<Path> loadFromEnvironment() throws IOException {
    return loadFromEnvironment(registry(), System.getenv(), System.getProperties());
  }

  /**
   * Loads the configured settings file into {@code registry}.
   *
   * @param registry registry to update
   * @param environment environment variables
   * @param properties system properties
   * @return the file loaded, or empty when none is configured or the file does not exist
   * @throws IOException if the file exists but cannot be read
   */
  public static Optional<Path> loadFromEnvironment(SettingsRegistry registry, Map<String, String> environment,
      Properties properties) throws IOException {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(environment, "environment");
    Objects.requireNonNull(properties, "properties");
    Optional<String> configured = nonBlank(properties.getProperty(SETTINGS_FILE_PROPERTY))
        .or(() -> nonBlank(environment.get(SETTINGS_FILE_ENV)));
    if (configured.isEmpty()) {
      log.debug("No settings file configured via {} or {}", SETTINGS_FILE_PROPERTY, SETTINGS_FILE_ENV);
      return Optional.empty();
    }
    Path path = Path.of(configured.get());
    if (!Files.exists(path)) {
      log.warn("Configured settings file {} does not exist; keeping declared defaults", path);
      return Optional.empty();
    }
    SettingsFiles.load(path, registry);
    return Optional.of(path);
  }

  private static Optional<String> nonBlank(String value) {
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
  }
}
