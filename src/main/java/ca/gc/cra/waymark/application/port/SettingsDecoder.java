package ca.gc.cra.waymark.application.port;

import ca.gc.cra.waymark.domain.errors.FormatException;
import java.util.Map;

/**
 * <strong>What:</strong> Port turning settings text (YAML, TOML, JSON) into the nested mapping consumed by bulk update.
 * <p><strong>Role:</strong> Implemented by infrastructure codecs; used only as input to
 * {@link ca.gc.cra.waymark.application.SettingsRegistry#load(String, SettingsDecoder)}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or thread-safe.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SettingsDecoder {
  /**
   * Decodes settings text.
   *
   * @param text document text; an empty document decodes to an empty map
   * @return nested mapping whose keys mirror the namespace tree
   * @throws FormatException if the text is malformed or its root is not a mapping
   */
  Map<String, Object> decode(String text);
}
