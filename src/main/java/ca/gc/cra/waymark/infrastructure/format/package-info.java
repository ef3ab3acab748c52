/**
 * <strong>Purpose:</strong> YAML, TOML and JSON codecs implementing the settings decoder and encoder ports.
 * <p><strong>Pipeline role:</strong> Decoded mappings feed bulk update; encoders render the namespace tree.
 * <p><strong>Concurrency:</strong> Codecs are stateless and safe to share.
 *
 * @since 0.1.0
 */
package ca.gc.cra.waymark.infrastructure.format;
