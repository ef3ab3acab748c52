/**
 * <strong>Purpose:</strong> Settings registry use cases: binding, three-tier value resolution, per-instance overrides
 * and bulk update/load.
 * <p><strong>Pipeline role:</strong> Sits between declaring code and the serialization adapters reached through
 * {@code application.port}.
 * <p><strong>Concurrency:</strong> Reads are safe from any thread; callers serialize mutation.
 * <p><strong>Observability:</strong> SLF4J DEBUG for bindings and updates, WARN for skipped lenient updates.
 *
 * @since 0.1.0
 */
package ca.gc.cra.waymark.application;
