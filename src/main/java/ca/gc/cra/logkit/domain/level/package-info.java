/**
 * Severity levels shared by the facade and its engine adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logkit.domain.level;
