package ca.gc.cra.waymark.infrastructure.format;

import ca.gc.cra.waymark.application.port.SettingsCodec;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Text formats understood by the settings registry.
 *
 * @since 0.1.0
 */
public enum SettingsFormat {
  YAML(YamlSettingsCodec::new, ".yaml", ".yml"),
  TOML(TomlSettingsCodec::new, ".toml"),
  JSON(JsonSettingsCodec::new, ".json");

  private final Supplier<SettingsCodec> factory;
  private final String[] extensions;

  SettingsFormat(Supplier<SettingsCodec> factory, String... extensions) {
    this.factory = factory;
    this.extensions = extensions;
  }

  /**
   * Creates a codec for this format.
   *
   * @return new decoder/encoder
   */
  public SettingsCodec codec() {
    return factory.get();
  }

  /**
   * Infers the format from a file name extension, ignoring case.
   *
   * @param path settings file
   * @return matching format
   * @throws IllegalArgumentException if the extension is not recognised
   */
  public static SettingsFormat fromPath(Path path) {
    Objects.requireNonNull(path, "path");
    Path fileName = path.getFileName();
    String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
    for (SettingsFormat format : values()) {
      for (String extension : format.extensions) {
        if (name.endsWith(extension)) {
          return format;
        }
      }
    }
    throw new IllegalArgumentException("Cannot infer settings format from file name: " + path
        + " (expected .yaml, .yml, .toml or .json)");
  }
}
