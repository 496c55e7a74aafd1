/**
 * <strong>Purpose:</strong> Ports between the logkit facade and the external logging engine.
 * <p><strong>Role:</strong> Channels, channel lookup, ambient map and stack, and the task context element contract.
 * <p><strong>Concurrency:</strong> Channel and provider implementations are shared across threads; ambient ports act
 * on thread-local state.
 * <p><strong>Observability:</strong> Adapters own all rendering; ports define no formatting.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logkit.application.port;
