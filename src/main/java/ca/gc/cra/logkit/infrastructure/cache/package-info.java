/**
 * Bounded caching of logger adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logkit.infrastructure.cache;
