package ca.gc.cra.logkit.api;

import ca.gc.cra.logkit.config.CompositionRoot;
import java.util.Objects;

/**
 * Factory methods for {@link FunctionalLogger} instances.
 *
 * <p>Owner-based lookups apply the companion rule: a nested class annotated {@link Companion} resolves to its
 * enclosing class. {@link #cachedLoggerOf(Class)} memoizes through the bounded cache owned by
 * {@link CompositionRoot}; the other factories build a fresh facade on each call.
 *
 * @since 0.1.0
 */
public final class Loggers {

  private Loggers() {}

  /**
   * Returns a logger with an explicit name.
   *
   * @param name engine logger name; must not be {@code null}
   * @return new facade
   */
  public static FunctionalLogger logger(String name) {
    Objects.requireNonNull(name, "name");
    return new FunctionalLogger(CompositionRoot.global().channels().getOrCreateChannel(name));
  }

  /**
   * Returns a logger named after {@code owner}.
   *
   * @param owner owning class; must not be {@code null}
   * @return new facade
   */
  public static FunctionalLogger loggerOf(Class<?> owner) {
    return logger(ownerName(owner));
  }

  /**
   * Returns the cached logger for {@code owner}, creating it on first use.
   *
   * @param owner owning class; must not be {@code null}
   * @return shared facade
   */
  public static FunctionalLogger cachedLoggerOf(Class<?> owner) {
    Objects.requireNonNull(owner, "owner");
    return CompositionRoot.global().loggerCache().computeIfAbsent(owner, Loggers::loggerOf);
  }

  /**
   * Outermost class name of {@code type}, dropping nested, anonymous and lambda suffixes.
   *
   * @param type class to inspect; must not be {@code null}
   * @return binary name up to the first {@code $}
   */
  public static String contextName(Class<?> type) {
    String name = Objects.requireNonNull(type, "type").getName();
    int nested = name.indexOf('$');
    return nested < 0 ? name : name.substring(0, nested);
  }

  public static String contextName(Object anchor) {
    return contextName(Objects.requireNonNull(anchor, "anchor").getClass());
  }

  static String ownerName(Class<?> owner) {
    Objects.requireNonNull(owner, "owner");
    Class<?> enclosing = owner.getEnclosingClass();
    if (enclosing != null && owner.isAnnotationPresent(Companion.class)) {
      return enclosing.getName();
    }
    return owner.getName();
  }
}
