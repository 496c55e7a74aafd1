/**
 * <strong>Purpose:</strong> Value types describing ambient logging state (context map and context stack).
 * <p><strong>Concurrency:</strong> Immutable snapshots; live state stays thread-local inside the logging engine.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logkit.domain.context;
