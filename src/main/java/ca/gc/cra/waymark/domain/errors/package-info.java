/**
 * <strong>Purpose:</strong> Failure taxonomy for the settings registry.
 * <p><strong>Concurrency:</strong> Exceptions are immutable.
 * <p><strong>Observability:</strong> Messages name the offending path, value, or condition so they can be logged as-is.
 *
 * @since 0.1.0
 */
package ca.gc.cra.waymark.domain.errors;
