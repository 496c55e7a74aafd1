package ca.gc.cra.logkit.config;

import ca.gc.cra.logkit.api.FunctionalLogger;
import ca.gc.cra.logkit.application.port.ChannelProvider;
import ca.gc.cra.logkit.application.port.ContextMapPort;
import ca.gc.cra.logkit.application.port.ContextStackPort;
import ca.gc.cra.logkit.infrastructure.cache.BoundedLoggerCache;
import ca.gc.cra.logkit.infrastructure.slf4j.MdcContextMap;
import ca.gc.cra.logkit.infrastructure.slf4j.MdcContextStack;
import ca.gc.cra.logkit.infrastructure.slf4j.Slf4jChannelProvider;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the logkit facade to its engine adapters.
 * <p><strong>Why:</strong> Provides a single place to translate configuration into channels, ambient-state ports,
 * and the owner-logger cache.</p>
 * <p><strong>Role:</strong> Adapter composition root behind the static facades in {@code ca.gc.cra.logkit.api}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Choose MDC-backed or disabled context ports according to {@link LogkitConfig}.</li>
 *   <li>Own the bounded cache used by {@code Loggers#cachedLoggerOf(Class)}.</li>
 *   <li>Hold the process-wide instance, created lazily from {@link ConfigLoader} and replaceable in tests.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Instances are immutable apart from the internally synchronized cache; the
 * global slot is volatile.</p>
 * <p><strong>Observability:</strong> Logs the effective configuration at DEBUG when an instance is built.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final Object GLOBAL_LOCK = new Object();
  private static volatile CompositionRoot global;

  private final LogkitConfig config;
  private final ChannelProvider channels;
  private final ContextMapPort contextMap;
  private final ContextStackPort contextStack;
  private final BoundedLoggerCache<Class<?>, FunctionalLogger> loggerCache;

  /**
   * Wires the default SLF4J adapters for {@code config}.
   *
   * @param config effective configuration; must not be {@code null}
   */
  public CompositionRoot(LogkitConfig config) {
    this(config, new Slf4jChannelProvider(Objects.requireNonNull(config, "config").traceMaxParamBytes()));
  }

  /**
   * Wires {@code config} with an explicit channel provider.
   *
   * @param config effective configuration; must not be {@code null}
   * @param channels provider used to resolve named channels; must not be {@code null}
   */
  public CompositionRoot(LogkitConfig config, ChannelProvider channels) {
    this.config = Objects.requireNonNull(config, "config");
    this.channels = Objects.requireNonNull(channels, "channels");
    if (config.contextMapEnabled()) {
      this.contextMap = config.contextStackEnabled()
          ? new MdcContextMap(config.contextStackKey())
          : new MdcContextMap();
    } else {
      this.contextMap = ContextMapPort.DISABLED;
    }
    this.contextStack =
        config.contextStackEnabled() ? new MdcContextStack(config.contextStackKey()) : ContextStackPort.DISABLED;
    this.loggerCache = new BoundedLoggerCache<>(config.cacheMaxEntries());
    log.debug("logkit wired with {}", config);
  }

  /**
   * Returns the process-wide root, loading configuration on first use.
   *
   * @return shared composition root
   */
  public static CompositionRoot global() {
    CompositionRoot current = global;
    if (current != null) {
      return current;
    }
    synchronized (GLOBAL_LOCK) {
      if (global == null) {
        global = new CompositionRoot(ConfigLoader.load());
      }
      return global;
    }
  }

  /**
   * Replaces the process-wide root.
   *
   * @param root new root; must not be {@code null}
   * @return previously installed root, or {@code null} if none was built yet
   */
  public static CompositionRoot install(CompositionRoot root) {
    Objects.requireNonNull(root, "root");
    synchronized (GLOBAL_LOCK) {
      CompositionRoot previous = global;
      global = root;
      return previous;
    }
  }

  /** Drops the process-wide root so the next {@link #global()} call reloads configuration. */
  public static void reset() {
    synchronized (GLOBAL_LOCK) {
      global = null;
    }
  }

  public LogkitConfig config() {
    return config;
  }

  public ChannelProvider channels() {
    return channels;
  }

  public ContextMapPort contextMap() {
    return contextMap;
  }

  public ContextStackPort contextStack() {
    return contextStack;
  }

  /**
   * Cache of owner loggers, bounded by {@link LogkitConfig#cacheMaxEntries()}.
   *
   * @return shared cache
   */
  public BoundedLoggerCache<Class<?>, FunctionalLogger> loggerCache() {
    return loggerCache;
  }
}
