/**
 * Public facade of logkit: deferred-evaluation loggers, logger factories, ambient context access and scoping.
 *
 * <p>Start with {@link ca.gc.cra.logkit.api.Loggers} or the {@link ca.gc.cra.logkit.api.Logging} mixin, and use
 * {@link ca.gc.cra.logkit.api.LoggingContext} to carry diagnostic context across scopes and threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logkit.api;
