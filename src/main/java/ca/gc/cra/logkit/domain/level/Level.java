package ca.gc.cra.logkit.domain.level;

import java.util.Locale;

/**
 * <strong>What:</strong> Ordered severity levels understood by the logkit facade.
 * <p><strong>Why:</strong> Call sites gate deferred work on a level without binding to an engine-specific enum.</p>
 * <p><strong>Role:</strong> Domain value used as the sole gating input of every logging call.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @implNote SLF4J has no FATAL level; the SLF4J adapter renders {@link #FATAL} as ERROR with a FATAL marker.
 * @since 0.1.0
 */
public enum Level {
  TRACE(0),
  DEBUG(10),
  INFO(20),
  WARN(30),
  ERROR(40),
  FATAL(50);

  private final int severity;

  Level(int severity) {
    this.severity = severity;
  }

  /**
   * Numeric severity; higher values are more severe.
   *
   * @return severity rank of this level
   */
  public int severity() {
    return severity;
  }

  /**
   * Tests whether this level is at least as severe as {@code threshold}.
   *
   * @param threshold level to compare against; must not be {@code null}
   * @return {@code true} when this level is equal to or more severe than {@code threshold}
   */
  public boolean isAtLeast(Level threshold) {
    return severity >= threshold.severity;
  }

  /**
   * Resolves a level from its case-insensitive name.
   *
   * @param name level name such as {@code "warn"}; surrounding whitespace ignored
   * @return matching level
   * @throws IllegalArgumentException if {@code name} is blank or unknown
   */
  public static Level parse(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("level must not be blank");
    }
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    for (Level level : values()) {
      if (level.name().equals(normalized)) {
        return level;
      }
    }
    throw new IllegalArgumentException("Unknown level: " + name);
  }
}
