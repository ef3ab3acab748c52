/**
 * File persistence for settings documents (UTF-8, format inferred from the extension).
 *
 * @since 0.1.0
 */
package ca.gc.cra.waymark.infrastructure.io;
