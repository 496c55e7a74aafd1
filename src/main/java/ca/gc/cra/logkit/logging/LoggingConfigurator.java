package ca.gc.cra.logkit.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Objects;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts logging-engine levels at runtime.
 * <p><strong>Why:</strong> The facade never filters on its own; samples, benchmarks, and tests change what the
 * engine accepts through this single bridge.</p>
 * <p><strong>Role:</strong> Adapter-side utility bridging logkit levels to the Logback backend.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Detect the active SLF4J implementation and adjust named or root logger levels.</li>
 *   <li>Warn when the backend does not support dynamic level changes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Level mutation is delegated to Logback, which publishes level changes safely.</p>
 * <p><strong>Observability:</strong> Emits SLF4J warnings when dynamic configuration is unsupported.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, ca.gc.cra.logkit.domain.level.Level.DEBUG);
  }

  /**
   * Sets the level of the named engine logger.
   *
   * @param loggerName logger name; {@link org.slf4j.Logger#ROOT_LOGGER_NAME} targets the root logger
   * @param level new threshold; {@code null} resets the logger to inherit its parent's level
   * @return {@code true} when the backend applied the change
   */
  public static boolean setLevel(String loggerName, ca.gc.cra.logkit.domain.level.Level level) {
    Objects.requireNonNull(loggerName, "loggerName");
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger target = context.getLogger(loggerName);
      target.setLevel(level == null ? null : toLogback(level));
      return true;
    }
    log.warn("Level change for {} requested but backend {} does not support dynamic level updates",
        loggerName, factory.getClass().getName());
    return false;
  }

  /**
   * Returns the level explicitly assigned to the named logger, if any.
   *
   * @param loggerName logger name
   * @return assigned level, or {@code null} when inherited or unsupported
   */
  public static ca.gc.cra.logkit.domain.level.Level levelOf(String loggerName) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Level assigned = context.getLogger(loggerName).getLevel();
      return assigned == null ? null : fromLogback(assigned);
    }
    return null;
  }

  private static Level toLogback(ca.gc.cra.logkit.domain.level.Level level) {
    switch (level) {
      case TRACE:
        return Level.TRACE;
      case DEBUG:
        return Level.DEBUG;
      case INFO:
        return Level.INFO;
      case WARN:
        return Level.WARN;
      default:
        return Level.ERROR;
    }
  }

  private static ca.gc.cra.logkit.domain.level.Level fromLogback(Level level) {
    switch (level.toInt()) {
      case Level.TRACE_INT:
      case Level.ALL_INT:
        return ca.gc.cra.logkit.domain.level.Level.TRACE;
      case Level.DEBUG_INT:
        return ca.gc.cra.logkit.domain.level.Level.DEBUG;
      case Level.INFO_INT:
        return ca.gc.cra.logkit.domain.level.Level.INFO;
      case Level.WARN_INT:
        return ca.gc.cra.logkit.domain.level.Level.WARN;
      default:
        return ca.gc.cra.logkit.domain.level.Level.ERROR;
    }
  }
}
