/**
 * <strong>Purpose:</strong> Logging backend utilities: runtime level control and bounded rendering.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe when invoked concurrently.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logkit.logging;
