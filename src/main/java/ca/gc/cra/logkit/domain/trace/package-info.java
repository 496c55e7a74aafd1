/**
 * Structured trace values exchanged between entry and exit notifications.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logkit.domain.trace;
