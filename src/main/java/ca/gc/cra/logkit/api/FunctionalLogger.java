package ca.gc.cra.logkit.api;

import ca.gc.cra.logkit.application.port.LogChannel;
import ca.gc.cra.logkit.domain.level.Level;
import ca.gc.cra.logkit.domain.trace.EntryMessage;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Supplier;
import org.slf4j.Marker;

/**
 * <strong>What:</strong> Logger facade whose messages can be supplied lazily and whose blocks can be traced.
 * <p><strong>Why:</strong> Call sites should not pay for building a message the engine would discard, nor write
 * level guards by hand.</p>
 * <p><strong>Role:</strong> Public entry point returned by {@link Loggers}, {@link Logging} and {@link LazyLogger}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Gate every call on the channel's level check; invoke message suppliers only for enabled events, at most once.</li>
 *   <li>Forward materialized messages and throwables unchanged to the channel.</li>
 *   <li>Report entry, exit, and failure of traced blocks.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless beyond the channel reference; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> A disabled call costs one level check and no allocation beyond the lambda.</p>
 *
 * @implNote Every event carries {@link #FQCN} so location-aware engines report the application call site.
 * @since 0.1.0
 */
public final class FunctionalLogger {
  /** Fully-qualified name handed to the engine to locate the caller frame. */
  public static final String FQCN = FunctionalLogger.class.getName();

  private final LogChannel channel;

  /**
   * Wraps {@code channel}.
   *
   * @param channel engine channel; must not be {@code null}
   */
  public FunctionalLogger(LogChannel channel) {
    this.channel = Objects.requireNonNull(channel, "channel");
  }

  /**
   * Underlying engine channel.
   *
   * @return channel
   */
  public LogChannel channel() {
    return channel;
  }

  public String name() {
    return channel.name();
  }

  public boolean isEnabled(Level level) {
    return channel.isEnabled(level, null);
  }

  public boolean isEnabled(Level level, Marker marker) {
    return channel.isEnabled(level, marker);
  }

  public boolean isTraceEnabled() {
    return channel.isEnabled(Level.TRACE, null);
  }

  public boolean isDebugEnabled() {
    return channel.isEnabled(Level.DEBUG, null);
  }

  public boolean isInfoEnabled() {
    return channel.isEnabled(Level.INFO, null);
  }

  public boolean isWarnEnabled() {
    return channel.isEnabled(Level.WARN, null);
  }

  public boolean isErrorEnabled() {
    return channel.isEnabled(Level.ERROR, null);
  }

  public boolean isFatalEnabled() {
    return channel.isEnabled(Level.FATAL, null);
  }

  // generic level

  public void log(Level level, Object message) {
    logIfEnabled(level, null, message, null);
  }

  public void log(Level level, Object message, Throwable cause) {
    logIfEnabled(level, null, message, cause);
  }

  public void log(Level level, Marker marker, Object message) {
    logIfEnabled(level, marker, message, null);
  }

  public void log(Level level, Marker marker, Object message, Throwable cause) {
    logIfEnabled(level, marker, message, cause);
  }

  /**
   * Logs the supplied message when {@code level} is enabled.
   *
   * @param level event severity
   * @param supplier message producer; invoked at most once, and only when the level is enabled
   */
  public void log(Level level, Supplier<?> supplier) {
    logIfEnabled(level, null, supplier, null);
  }

  public void log(Level level, Throwable cause, Supplier<?> supplier) {
    logIfEnabled(level, null, supplier, cause);
  }

  public void log(Level level, Marker marker, Supplier<?> supplier) {
    logIfEnabled(level, marker, supplier, null);
  }

  public void log(Level level, Marker marker, Throwable cause, Supplier<?> supplier) {
    logIfEnabled(level, marker, supplier, cause);
  }

  // TRACE

  public void trace(Object message) {
    logIfEnabled(Level.TRACE, null, message, null);
  }

  public void trace(Object message, Throwable cause) {
    logIfEnabled(Level.TRACE, null, message, cause);
  }

  public void trace(Marker marker, Object message) {
    logIfEnabled(Level.TRACE, marker, message, null);
  }

  public void trace(Marker marker, Object message, Throwable cause) {
    logIfEnabled(Level.TRACE, marker, message, cause);
  }

  public void trace(Supplier<?> supplier) {
    logIfEnabled(Level.TRACE, null, supplier, null);
  }

  public void trace(Throwable cause, Supplier<?> supplier) {
    logIfEnabled(Level.TRACE, null, supplier, cause);
  }

  public void trace(Marker marker, Supplier<?> supplier) {
    logIfEnabled(Level.TRACE, marker, supplier, null);
  }

  public void trace(Marker marker, Throwable cause, Supplier<?> supplier) {
    logIfEnabled(Level.TRACE, marker, supplier, cause);
  }

  // DEBUG

  public void debug(Object message) {
    logIfEnabled(Level.DEBUG, null, message, null);
  }

  public void debug(Object message, Throwable cause) {
    logIfEnabled(Level.DEBUG, null, message, cause);
  }

  public void debug(Marker marker, Object message) {
    logIfEnabled(Level.DEBUG, marker, message, null);
  }

  public void debug(Marker marker, Object message, Throwable cause) {
    logIfEnabled(Level.DEBUG, marker, message, cause);
  }

  public void debug(Supplier<?> supplier) {
    logIfEnabled(Level.DEBUG, null, supplier, null);
  }

  public void debug(Throwable cause, Supplier<?> supplier) {
    logIfEnabled(Level.DEBUG, null, supplier, cause);
  }

  public void debug(Marker marker, Supplier<?> supplier) {
    logIfEnabled(Level.DEBUG, marker, supplier, null);
  }

  public void debug(Marker marker, Throwable cause, Supplier<?> supplier) {
    logIfEnabled(Level.DEBUG, marker, supplier, cause);
  }

  // INFO

  public void info(Object message) {
    logIfEnabled(Level.INFO, null, message, null);
  }

  public void info(Object message, Throwable cause) {
    logIfEnabled(Level.INFO, null, message, cause);
  }

  public void info(Marker marker, Object message) {
    logIfEnabled(Level.INFO, marker, message, null);
  }

  public void info(Marker marker, Object message, Throwable cause) {
    logIfEnabled(Level.INFO, marker, message, cause);
  }

  public void info(Supplier<?> supplier) {
    logIfEnabled(Level.INFO, null, supplier, null);
  }

  public void info(Throwable cause, Supplier<?> supplier) {
    logIfEnabled(Level.INFO, null, supplier, cause);
  }

  public void info(Marker marker, Supplier<?> supplier) {
    logIfEnabled(Level.INFO, marker, supplier, null);
  }

  public void info(Marker marker, Throwable cause, Supplier<?> supplier) {
    logIfEnabled(Level.INFO, marker, supplier, cause);
  }

  // WARN

  public void warn(Object message) {
    logIfEnabled(Level.WARN, null, message, null);
  }

  public void warn(Object message, Throwable cause) {
    logIfEnabled(Level.WARN, null, message, cause);
  }

  public void warn(Marker marker, Object message) {
    logIfEnabled(Level.WARN, marker, message, null);
  }

  public void warn(Marker marker, Object message, Throwable cause) {
    logIfEnabled(Level.WARN, marker, message, cause);
  }

  public void warn(Supplier<?> supplier) {
    logIfEnabled(Level.WARN, null, supplier, null);
  }

  public void warn(Throwable cause, Supplier<?> supplier) {
    logIfEnabled(Level.WARN, null, supplier, cause);
  }

  public void warn(Marker marker, Supplier<?> supplier) {
    logIfEnabled(Level.WARN, marker, supplier, null);
  }

  public void warn(Marker marker, Throwable cause, Supplier<?> supplier) {
    logIfEnabled(Level.WARN, marker, supplier, cause);
  }

  // ERROR

  public void error(Object message) {
    logIfEnabled(Level.ERROR, null, message, null);
  }

  public void error(Object message, Throwable cause) {
    logIfEnabled(Level.ERROR, null, message, cause);
  }

  public void error(Marker marker, Object message) {
    logIfEnabled(Level.ERROR, marker, message, null);
  }

  public void error(Marker marker, Object message, Throwable cause) {
    logIfEnabled(Level.ERROR, marker, message, cause);
  }

  public void error(Supplier<?> supplier) {
    logIfEnabled(Level.ERROR, null, supplier, null);
  }

  public void error(Throwable cause, Supplier<?> supplier) {
    logIfEnabled(Level.ERROR, null, supplier, cause);
  }

  public void error(Marker marker, Supplier<?> supplier) {
    logIfEnabled(Level.ERROR, marker, supplier, null);
  }

  public void error(Marker marker, Throwable cause, Supplier<?> supplier) {
    logIfEnabled(Level.ERROR, marker, supplier, cause);
  }

  // FATAL

  public void fatal(Object message) {
    logIfEnabled(Level.FATAL, null, message, null);
  }

  public void fatal(Object message, Throwable cause) {
    logIfEnabled(Level.FATAL, null, message, cause);
  }

  public void fatal(Marker marker, Object message) {
    logIfEnabled(Level.FATAL, marker, message, null);
  }

  public void fatal(Marker marker, Object message, Throwable cause) {
    logIfEnabled(Level.FATAL, marker, message, cause);
  }

  public void fatal(Supplier<?> supplier) {
    logIfEnabled(Level.FATAL, null, supplier, null);
  }

  public void fatal(Throwable cause, Supplier<?> supplier) {
    logIfEnabled(Level.FATAL, null, supplier, cause);
  }

  public void fatal(Marker marker, Supplier<?> supplier) {
    logIfEnabled(Level.FATAL, marker, supplier, null);
  }

  public void fatal(Marker marker, Throwable cause, Supplier<?> supplier) {
    logIfEnabled(Level.FATAL, marker, supplier, cause);
  }

  // flow tracing

  /**
   * Reports entry into a method without parameters.
   *
   * @return handle to pass to {@link #traceExit(EntryMessage)}
   */
  public EntryMessage traceEntry() {
    channel.traceEntry(FQCN, EntryMessage.EMPTY);
    return EntryMessage.EMPTY;
  }

  /**
   * Reports entry into a method with the given parameters.
   *
   * @param params parameter values; {@code null} elements are rendered as {@code null}
   * @return handle to pass to {@link #traceExit(EntryMessage)}
   */
  public EntryMessage traceEntry(Object... params) {
    EntryMessage entry = EntryMessage.ofParams(params);
    channel.traceEntry(FQCN, entry);
    return entry;
  }

  /**
   * Reports entry with lazily computed parameters.
   *
   * @param paramSuppliers parameter producers, each invoked once when TRACE is enabled
   * @return handle to pass to {@link #traceExit(EntryMessage)}, or {@code null} when TRACE is disabled
   */
  public EntryMessage traceEntry(Supplier<?>... paramSuppliers) {
    if (!isTraceEnabled()) {
      return null;
    }
    Object[] params = new Object[paramSuppliers == null ? 0 : paramSuppliers.length];
    for (int i = 0; i < params.length; i++) {
      params[i] = paramSuppliers[i].get();
    }
    EntryMessage entry = EntryMessage.ofParams(params);
    channel.traceEntry(FQCN, entry);
    return entry;
  }

  public EntryMessage traceEntry(CharSequence message) {
    EntryMessage entry = EntryMessage.ofMessage(message);
    channel.traceEntry(FQCN, entry);
    return entry;
  }

  /**
   * Reports entry with a lazily computed message.
   *
   * @param messageSupplier message producer, invoked once when TRACE is enabled
   * @return handle to pass to {@link #traceExit(EntryMessage)}, or {@code null} when TRACE is disabled
   */
  public EntryMessage traceEntry(Supplier<? extends CharSequence> messageSupplier) {
    Objects.requireNonNull(messageSupplier, "messageSupplier");
    if (!isTraceEnabled()) {
      return null;
    }
    EntryMessage entry = EntryMessage.ofMessage(messageSupplier.get());
    channel.traceEntry(FQCN, entry);
    return entry;
  }

  /**
   * Reports exit from a block that produced no value.
   *
   * @param entry handle returned on entry; may be {@code null}
   */
  public void traceExit(EntryMessage entry) {
    channel.traceExit(FQCN, entry, null, false);
  }

  /**
   * Reports exit from a block together with its result.
   *
   * @param entry handle returned on entry; may be {@code null}
   * @param result value produced by the block
   * @param <R> result type
   * @return {@code result}
   */
  public <R> R traceExit(EntryMessage entry, R result) {
    channel.traceExit(FQCN, entry, result, true);
    return result;
  }

  public void catching(Throwable throwable) {
    channel.catching(FQCN, Objects.requireNonNull(throwable, "throwable"));
  }

  /**
   * Reports an exception the caller is about to throw.
   *
   * @param throwable exception to report
   * @param <T> exception type
   * @return {@code throwable}, for use in a {@code throw} statement
   */
  public <T extends Throwable> T throwing(T throwable) {
    channel.throwing(FQCN, Objects.requireNonNull(throwable, "throwable"));
    return throwable;
  }

  /**
   * Runs {@code block} between an entry and an exit notification.
   *
   * <p>A {@code null} result is reported as a plain {@code Exit}, whatever the declared result type: a
   * {@code Callable<String>} that returns {@code null} logs the same exit as a {@code Callable<Void>}. Use
   * {@link #traceExit(EntryMessage, Object)} directly to log {@code Exit with(null)}.
   *
   * @param block work to run
   * @param <R> result type
   * @return value produced by {@code block}
   */
  public <R> R runInTrace(Callable<R> block) {
    return runInTrace(traceEntry(), block);
  }

  /**
   * Runs {@code block} and reports its exit against an existing entry.
   *
   * <p>A {@code null} result is reported as an exit without a value. When {@code block} throws, the throwable is
   * reported once through {@link #catching(Throwable)} and rethrown unchanged, checked or not; no exit is reported.
   *
   * @param entry handle returned by one of the {@code traceEntry} methods; may be {@code null}
   * @param block work to run
   * @param <R> result type
   * @return value produced by {@code block}
   */
  public <R> R runInTrace(EntryMessage entry, Callable<R> block) {
    Objects.requireNonNull(block, "block");
    R result;
    try {
      result = block.call();
    } catch (Throwable t) {
      catching(t);
      throw FunctionalLogger.<RuntimeException>sneakyThrow(t);
    }
    if (result == null) {
      traceExit(entry);
    } else {
      traceExit(entry, result);
    }
    return result;
  }

  public void runInTrace(Runnable block) {
    runInTrace(traceEntry(), block);
  }

  public void runInTrace(EntryMessage entry, Runnable block) {
    Objects.requireNonNull(block, "block");
    try {
      block.run();
    } catch (Throwable t) {
      catching(t);
      throw FunctionalLogger.<RuntimeException>sneakyThrow(t);
    }
    traceExit(entry);
  }

  private void logIfEnabled(Level level, Marker marker, Object message, Throwable cause) {
    if (channel.isEnabled(level, marker)) {
      channel.log(FQCN, level, marker, message, cause);
    }
  }

  private void logIfEnabled(Level level, Marker marker, Supplier<?> supplier, Throwable cause) {
    Objects.requireNonNull(supplier, "supplier");
    if (channel.isEnabled(level, marker)) {
      Object message = supplier.get();
      channel.log(FQCN, level, marker, message, cause);
    }
  }

  @SuppressWarnings("unchecked")
  private static <T extends Throwable> T sneakyThrow(Throwable t) throws T {
    throw (T) t;
  }

  @Override
  public String toString() {
    return "FunctionalLogger{" + channel.name() + "}";
  }
}
