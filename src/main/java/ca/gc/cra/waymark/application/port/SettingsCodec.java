package ca.gc.cra.waymark.application.port;

/**
 * Decoder and encoder pair for one text format.
 *
 * @since 0.1.0
 */
public interface SettingsCodec extends SettingsDecoder, SettingsEncoder {}
