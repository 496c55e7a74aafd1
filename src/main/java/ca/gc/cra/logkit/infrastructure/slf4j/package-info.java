/**
 * <strong>Purpose:</strong> SLF4J adapters implementing the logkit engine ports.
 * <p><strong>Pipeline role:</strong> Channels forward gated events to SLF4J loggers; context adapters store ambient
 * state in the MDC map and an MDC deque.
 * <p><strong>Concurrency:</strong> Adapters are stateless; MDC storage is thread-local.
 * <p><strong>Observability:</strong> Flow events carry {@link ca.gc.cra.logkit.infrastructure.slf4j.FlowMarkers}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logkit.infrastructure.slf4j;
