/**
 * <strong>Purpose:</strong> Logging utilities that keep value renderings short before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers.
 * <p><strong>Observability:</strong> Coordinates with SLF4J callers; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.waymark.logging;
