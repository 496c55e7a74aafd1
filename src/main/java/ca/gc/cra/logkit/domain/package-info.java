/**
 * <strong>Purpose:</strong> Engine-neutral domain values for logkit: levels, context snapshots, trace entries.
 * <p><strong>Concurrency:</strong> All types are immutable.
 * <p><strong>Observability:</strong> No logging from this layer.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logkit.domain;
