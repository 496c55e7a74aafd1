package ca.gc.cra.logkit.config;

import ca.gc.cra.logkit.validation.Numbers;
import ca.gc.cra.logkit.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable runtime configuration of the logkit facade.
 * <p><strong>Why:</strong> Cache bounds, ambient-state switches, and rendering budgets differ between services and
 * test suites.</p>
 * <p><strong>Role:</strong> Configuration record consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param cacheMaxEntries maximum number of cached owner loggers
 * @param contextStackKey MDC deque key holding the context stack
 * @param contextMapEnabled {@code false} turns the context map into a read-empty, write-ignore store
 * @param contextStackEnabled {@code false} turns the context stack into a read-empty, write-ignore store
 * @param traceMaxParamBytes UTF-8 byte budget for each rendered trace parameter or result
 * @since 0.1.0
 */
public record LogkitConfig(
    int cacheMaxEntries,
    String contextStackKey,
    boolean contextMapEnabled,
    boolean contextStackEnabled,
    int traceMaxParamBytes) {

  public static final String CACHE_MAX_ENTRIES = "cache.maxEntries";
  public static final String CONTEXT_STACK_KEY = "context.stackKey";
  public static final String CONTEXT_MAP_ENABLED = "context.mapEnabled";
  public static final String CONTEXT_STACK_ENABLED = "context.stackEnabled";
  public static final String TRACE_MAX_PARAM_BYTES = "trace.maxParamBytes";

  public LogkitConfig {
    Numbers.requireRange(CACHE_MAX_ENTRIES, cacheMaxEntries, 1, 1_000_000);
    contextStackKey = Strings.requireNonBlank(CONTEXT_STACK_KEY, contextStackKey);
    Numbers.requireRange(TRACE_MAX_PARAM_BYTES, traceMaxParamBytes, 16, 1 << 20);
  }

  /**
   * Provides default configuration values used when no external config is supplied.
   *
   * @return default configuration record
   */
  public static LogkitConfig defaults() {
    return new LogkitConfig(100, "NDC", true, true, 256);
  }

  /**
   * Returns the defaults as a flat key/value map, the lowest-precedence layer of {@link ConfigMerger}.
   *
   * @return mutable map of default settings
   */
  public static Map<String, String> defaultsAsMap() {
    LogkitConfig defaults = defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put(CACHE_MAX_ENTRIES, String.valueOf(defaults.cacheMaxEntries()));
    map.put(CONTEXT_STACK_KEY, defaults.contextStackKey());
    map.put(CONTEXT_MAP_ENABLED, String.valueOf(defaults.contextMapEnabled()));
    map.put(CONTEXT_STACK_ENABLED, String.valueOf(defaults.contextStackEnabled()));
    map.put(TRACE_MAX_PARAM_BYTES, String.valueOf(defaults.traceMaxParamBytes()));
    return map;
  }

  /**
   * Builds a configuration from flat settings; missing keys fall back to {@link #defaults()}.
   *
   * @param settings flat key/value settings; must not be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static LogkitConfig fromMap(Map<String, String> settings) {
    Objects.requireNonNull(settings, "settings");
    LogkitConfig defaults = defaults();
    int cacheMax = settings.containsKey(CACHE_MAX_ENTRIES)
        ? Numbers.parseInt(CACHE_MAX_ENTRIES, settings.get(CACHE_MAX_ENTRIES), 1, 1_000_000)
        : defaults.cacheMaxEntries();
    String stackKey = settings.getOrDefault(CONTEXT_STACK_KEY, defaults.contextStackKey());
    boolean mapEnabled = parseBoolean(CONTEXT_MAP_ENABLED, settings.get(CONTEXT_MAP_ENABLED), defaults.contextMapEnabled());
    boolean stackEnabled =
        parseBoolean(CONTEXT_STACK_ENABLED, settings.get(CONTEXT_STACK_ENABLED), defaults.contextStackEnabled());
    int maxParamBytes = settings.containsKey(TRACE_MAX_PARAM_BYTES)
        ? Numbers.parseInt(TRACE_MAX_PARAM_BYTES, settings.get(TRACE_MAX_PARAM_BYTES), 16, 1 << 20)
        : defaults.traceMaxParamBytes();
    return new LogkitConfig(cacheMax, stackKey, mapEnabled, stackEnabled, maxParamBytes);
  }

  private static boolean parseBoolean(String name, String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if ("true".equals(normalized)) {
      return true;
    }
    if ("false".equals(normalized)) {
      return false;
    }
    throw new IllegalArgumentException(name + " must be true or false (was " + value + ")");
  }
}
