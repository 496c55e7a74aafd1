package ca.gc.cra.logkit.api;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Memoized logger accessor that resolves its {@link FunctionalLogger} on first use.
 *
 * <p>Useful for fields initialized before logging is configured:
 * <pre>{@code
 * private static final LazyLogger LOG = LazyLogger.forClass(Billing.class);
 * ...
 * LOG.get().debug(() -> "total " + total);
 * }</pre>
 *
 * <p>The factory runs at most once, even when several threads race on the first {@link #get()}.
 *
 * @since 0.1.0
 */
public final class LazyLogger implements Supplier<FunctionalLogger> {
  private final Object lock = new Object();
  private final Supplier<FunctionalLogger> factory;
  private volatile FunctionalLogger logger;

  private LazyLogger(Supplier<FunctionalLogger> factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /**
   * Lazily resolves {@link Loggers#loggerOf(Class)} for {@code owner}.
   *
   * @param owner owning class
   * @return lazy accessor
   */
  public static LazyLogger forClass(Class<?> owner) {
    Objects.requireNonNull(owner, "owner");
    return new LazyLogger(() -> Loggers.loggerOf(owner));
  }

  public static LazyLogger named(String name) {
    Objects.requireNonNull(name, "name");
    return new LazyLogger(() -> Loggers.logger(name));
  }

  public static LazyLogger of(Supplier<FunctionalLogger> factory) {
    return new LazyLogger(factory);
  }

  @Override
  public FunctionalLogger get() {
    FunctionalLogger current = logger;
    if (current != null) {
      return current;
    }
    synchronized (lock) {
      if (logger == null) {
        logger = Objects.requireNonNull(factory.get(), "factory returned null");
      }
      return logger;
    }
  }

  public boolean isInitialized() {
    return logger != null;
  }
}
