package ca.gc.cra.logkit.application.port;

import ca.gc.cra.logkit.domain.level.Level;
import ca.gc.cra.logkit.domain.trace.EntryMessage;
import java.util.function.Supplier;
import org.slf4j.Marker;

/**
 * <strong>What:</strong> Port for a named logging channel owned by the external logging engine.
 * <p><strong>Why:</strong> Keeps the deferred-evaluation facade independent of how the engine filters, formats,
 * and appends.</p>
 * <p><strong>Role:</strong> Engine port implemented by adapters such as {@code Slf4jLogChannel}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Answer level checks, optionally refined by a marker.</li>
 *   <li>Accept materialized and deferred messages with an optional cause.</li>
 *   <li>Render structured trace notifications (entry, exit, catching, throwing).</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use; channels are shared.</p>
 * <p><strong>Performance:</strong> {@link #isEnabled(Level, Marker)} sits on every call's hot path.</p>
 *
 * @implNote Every logging method receives the fully-qualified name of the calling facade class so location-aware
 * engines can report the application call site.
 * @since 0.1.0
 */
public interface LogChannel {

  /**
   * Name of the channel as known by the engine.
   *
   * @return channel name; never {@code null}
   */
  String name();

  /**
   * Checks whether an event at {@code level} carrying {@code marker} would be processed.
   *
   * @param level severity to test; must not be {@code null}
   * @param marker optional marker; {@code null} when the call is untagged
   * @return {@code true} when the engine accepts such events
   */
  boolean isEnabled(Level level, Marker marker);

  /**
   * Logs a materialized message. Callers have already checked {@link #isEnabled(Level, Marker)}.
   *
   * @param fqcn fully-qualified name of the facade class invoking the channel
   * @param level event severity
   * @param marker optional marker
   * @param message message object; {@link CharSequence} values are treated as literal text
   * @param cause optional throwable attached to the event
   */
  void log(String fqcn, Level level, Marker marker, Object message, Throwable cause);

  /**
   * Logs a deferred message, invoking {@code supplier} only when the level is enabled.
   *
   * @param fqcn fully-qualified name of the facade class invoking the channel
   * @param level event severity
   * @param marker optional marker
   * @param supplier producer of the message; invoked at most once
   * @param cause optional throwable attached to the event
   */
  void log(String fqcn, Level level, Marker marker, Supplier<?> supplier, Throwable cause);

  /**
   * Notifies entry into a traced block.
   *
   * @param fqcn fully-qualified name of the facade class invoking the channel
   * @param entry entry description; never {@code null}
   */
  void traceEntry(String fqcn, EntryMessage entry);

  /**
   * Notifies exit from a traced block.
   *
   * @param fqcn fully-qualified name of the facade class invoking the channel
   * @param entry handle returned on entry; may be {@code null} when entry tracing was disabled
   * @param result block result, ignored when {@code hasResult} is {@code false}
   * @param hasResult {@code false} for blocks that produce no meaningful value
   */
  void traceExit(String fqcn, EntryMessage entry, Object result, boolean hasResult);

  /**
   * Reports an exception caught inside a traced block.
   *
   * @param fqcn fully-qualified name of the facade class invoking the channel
   * @param throwable caught exception; never {@code null}
   */
  void catching(String fqcn, Throwable throwable);

  /**
   * Reports an exception about to be thrown by the caller.
   *
   * @param fqcn fully-qualified name of the facade class invoking the channel
   * @param throwable exception about to be thrown; never {@code null}
   */
  void throwing(String fqcn, Throwable throwable);
}
