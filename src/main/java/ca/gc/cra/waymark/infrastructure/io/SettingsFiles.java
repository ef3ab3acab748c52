package ca.gc.cra.waymark.infrastructure.io;

import ca.gc.cra.waymark.application.SettingsRegistry;
import ca.gc.cra.waymark.infrastructure.format.SettingsFormat;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads and writes settings files for a registry.
 * <p><strong>Why:</strong> Keeps file handling (encoding, format inference) out of the registry, which only sees
 * text.</p>
 * <p><strong>Thread-safety:</strong> Stateless; registry mutation must still be serialized by the caller.</p>
 *
 * @since 0.1.0
 */
public final class SettingsFiles {
  private static final Logger log = LoggerFactory.getLogger(SettingsFiles.class);

  private SettingsFiles() {}

  /**
   * Loads a settings file, inferring the format from its extension.
   *
   * @param path settings file
   * @param registry registry to update
   * @return number of settings updated
   * @throws IOException if the file cannot be read
   */
  public static int load(Path path, SettingsRegistry registry) throws IOException {
    return load(path, registry, SettingsFormat.fromPath(path));
  }

  /**
   * Loads a settings file in the given format.
   *
   * @param path settings file
   * @param registry registry to update
   * @param format document format
   * @return number of settings updated
   * @throws IOException if the file cannot be read
   * @throws ca.gc.cra.waymark.domain.errors.SettingsException if decoding or an update fails
   */
  public static int load(Path path, SettingsRegistry registry, SettingsFormat format) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(format, "format");
    String text = Files.readString(path, StandardCharsets.UTF_8);
    int applied = registry.load(text, format.codec());
    log.info("Loaded {} settings from {} ({})", applied, path, format);
    return applied;
  }

  /**
   * Saves the registry, inferring the format from the file extension.
   *
   * @param path target file; replaced if present
   * @param registry registry to render
   * @throws IOException if the file cannot be written
   */
  public static void save(Path path, SettingsRegistry registry) throws IOException {
    save(path, registry, SettingsFormat.fromPath(path));
  }

  /**
   * Saves the registry in the given format.
   *
   * @param path target file; replaced if present
   * @param registry registry to render
   * @param format document format
   * @throws IOException if the file cannot be written
   */
  public static void save(Path path, SettingsRegistry registry, SettingsFormat format) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(format, "format");
    String text = registry.encode(format.codec());
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(path, text, StandardCharsets.UTF_8);
    log.info("Saved settings to {} ({})", path, format);
  }
}
