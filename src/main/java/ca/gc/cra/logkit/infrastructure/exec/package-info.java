/**
 * Executors that carry logging context from submitting threads to workers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logkit.infrastructure.exec;
