/**
 * <strong>Purpose:</strong> Static entry point tying the global settings registry to file discovery and the text
 * codecs.
 * <p><strong>Configuration:</strong> {@code waymark.settings.file} system property or {@code WAYMARK_SETTINGS_FILE}
 * environment variable.
 *
 * @since 0.1.0
 */
package ca.gc.cra.waymark.config;
