/**
 * <strong>Purpose:</strong> Settings, conditions and the namespace tree they are bound into.
 * <p><strong>Invariants:</strong> A setting's value always has one of its allowed types, satisfies every condition and
 * is immutable. A bound name is never rebound to a different entry.
 * <p><strong>Concurrency:</strong> Setting values are published through volatile fields; namespace nodes synchronize
 * on their own entry table.
 *
 * @since 0.1.0
 */
package ca.gc.cra.waymark.domain;
