package ca.gc.cra.logkit.infrastructure.slf4j;

import ca.gc.cra.logkit.application.port.LogChannel;
import ca.gc.cra.logkit.domain.level.Level;
import ca.gc.cra.logkit.domain.trace.EntryMessage;
import ca.gc.cra.logkit.logging.Logs;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.Marker;
import org.slf4j.spi.LocationAwareLogger;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * <strong>What:</strong> {@link LogChannel} backed by an SLF4J {@link Logger}.
 * <p><strong>Why:</strong> Lets the facade gate, log, and trace through whatever SLF4J binding is on the classpath.</p>
 * <p><strong>Role:</strong> Engine adapter created by {@link Slf4jChannelProvider}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map logkit levels to SLF4J levels, rendering FATAL as ERROR with {@link FlowMarkers#FATAL}.</li>
 *   <li>Forward events through {@link LocationAwareLogger} when available so caller data names the call site.</li>
 *   <li>Render flow messages ({@code Enter}, {@code Exit with(...)}, {@code Catching}) with bounded parameters.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless beyond the wrapped logger; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Level checks delegate directly to SLF4J; rendering happens only for enabled events.</p>
 *
 * @since 0.1.0
 */
public final class Slf4jLogChannel implements LogChannel {
  private final Logger logger;
  private final int maxParamBytes;

  /**
   * Creates a channel around the given SLF4J logger.
   *
   * @param logger SLF4J logger; must not be {@code null}
   * @param maxParamBytes byte budget for each rendered trace parameter or result; must be positive
   */
  public Slf4jLogChannel(Logger logger, int maxParamBytes) {
    this.logger = Objects.requireNonNull(logger, "logger");
    if (maxParamBytes <= 0) {
      throw new IllegalArgumentException("maxParamBytes must be positive");
    }
    this.maxParamBytes = maxParamBytes;
  }

  /**
   * Returns the wrapped SLF4J logger.
   *
   * @return underlying logger
   */
  public Logger logger() {
    return logger;
  }

  @Override
  public String name() {
    return logger.getName();
  }

  @Override
  public boolean isEnabled(Level level, Marker marker) {
    Objects.requireNonNull(level, "level");
    if (level == Level.FATAL) {
      return logger.isErrorEnabled(FlowMarkers.fatal(marker));
    }
    if (marker == null) {
      switch (level) {
        case TRACE:
          return logger.isTraceEnabled();
        case DEBUG:
          return logger.isDebugEnabled();
        case INFO:
          return logger.isInfoEnabled();
        case WARN:
          return logger.isWarnEnabled();
        default:
          return logger.isErrorEnabled();
      }
    }
    switch (level) {
      case TRACE:
        return logger.isTraceEnabled(marker);
      case DEBUG:
        return logger.isDebugEnabled(marker);
      case INFO:
        return logger.isInfoEnabled(marker);
      case WARN:
        return logger.isWarnEnabled(marker);
      default:
        return logger.isErrorEnabled(marker);
    }
  }

  @Override
  public void log(String fqcn, Level level, Marker marker, Object message, Throwable cause) {
    Marker effective = level == Level.FATAL ? FlowMarkers.fatal(marker) : marker;
    if (message instanceof CharSequence || message instanceof Throwable) {
      emit(fqcn, level, effective, String.valueOf(message), null, cause);
    } else {
      emit(fqcn, level, effective, "{}", new Object[] {message}, cause);
    }
  }

  @Override
  public void log(String fqcn, Level level, Marker marker, Supplier<?> supplier, Throwable cause) {
    if (isEnabled(level, marker)) {
      log(fqcn, level, marker, supplier.get(), cause);
    }
  }

  @Override
  public void traceEntry(String fqcn, EntryMessage entry) {
    if (!logger.isTraceEnabled(FlowMarkers.ENTER)) {
      return;
    }
    emit(fqcn, Level.TRACE, FlowMarkers.ENTER, renderEntry(entry), null, null);
  }

  @Override
  public void traceExit(String fqcn, EntryMessage entry, Object result, boolean hasResult) {
    if (!logger.isTraceEnabled(FlowMarkers.EXIT)) {
      return;
    }
    String text = hasResult ? "Exit with(" + Logs.render(result, maxParamBytes) + ")" : "Exit";
    emit(fqcn, Level.TRACE, FlowMarkers.EXIT, text, null, null);
  }

  @Override
  public void catching(String fqcn, Throwable throwable) {
    if (logger.isErrorEnabled(FlowMarkers.CATCHING)) {
      emit(fqcn, Level.ERROR, FlowMarkers.CATCHING, "Catching", null, throwable);
    }
  }

  @Override
  public void throwing(String fqcn, Throwable throwable) {
    if (logger.isErrorEnabled(FlowMarkers.THROWING)) {
      emit(fqcn, Level.ERROR, FlowMarkers.THROWING, "Throwing", null, throwable);
    }
  }

  private String renderEntry(EntryMessage entry) {
    if (entry == null) {
      return "Enter";
    }
    if (entry.message() != null) {
      return "Enter " + Logs.truncate(entry.message().toString(), maxParamBytes);
    }
    if (entry.params() == null || entry.params().isEmpty()) {
      return "Enter";
    }
    StringJoiner joiner = new StringJoiner(", ", "Enter params(", ")");
    for (Object param : entry.params()) {
      joiner.add(Logs.render(param, maxParamBytes));
    }
    return joiner.toString();
  }

  private void emit(String fqcn, Level level, Marker marker, String pattern, Object[] args, Throwable cause) {
    if (logger instanceof LocationAwareLogger aware) {
      aware.log(marker, fqcn, toSlf4j(level).toInt(), pattern, args, cause);
      return;
    }
    LoggingEventBuilder builder = logger.atLevel(toSlf4j(level));
    if (marker != null) {
      builder = builder.addMarker(marker);
    }
    if (args != null) {
      for (Object arg : args) {
        builder = builder.addArgument(arg);
      }
    }
    if (cause != null) {
      builder = builder.setCause(cause);
    }
    builder.log(pattern);
  }

  static org.slf4j.event.Level toSlf4j(Level level) {
    switch (level) {
      case TRACE:
        return org.slf4j.event.Level.TRACE;
      case DEBUG:
        return org.slf4j.event.Level.DEBUG;
      case INFO:
        return org.slf4j.event.Level.INFO;
      case WARN:
        return org.slf4j.event.Level.WARN;
      default:
        return org.slf4j.event.Level.ERROR;
    }
  }

  @Override
  public String toString() {
    return "Slf4jLogChannel{" + logger.getName() + "}";
  }
}
