/**
 * <strong>Purpose:</strong> Ports between the settings registry and the serialization adapters.
 * <p><strong>Pipeline role:</strong> Decoders feed bulk update; encoders render the tree for persistence.
 * <p><strong>Concurrency:</strong> Implementations are expected to be stateless.
 *
 * @since 0.1.0
 */
package ca.gc.cra.waymark.application.port;
