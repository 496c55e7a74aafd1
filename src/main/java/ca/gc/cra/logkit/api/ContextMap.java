package ca.gc.cra.logkit.api;

import ca.gc.cra.logkit.application.port.ContextMapPort;
import ca.gc.cra.logkit.config.CompositionRoot;
import java.util.Collection;
import java.util.Map;

/**
 * Static access to the current thread's diagnostic context map.
 *
 * <p>Entries end up in the engine's MDC and are rendered by appender patterns such as {@code %X{requestId}}. When
 * the map is disabled by configuration, reads return empty results and writes are ignored.
 *
 * @since 0.1.0
 */
public final class ContextMap {

  private ContextMap() {}

  public static String get(String key) {
    return port().get(key);
  }

  public static boolean containsKey(String key) {
    return port().containsKey(key);
  }

  /**
   * Sets {@code key} to {@code value}; a {@code null} value removes the key.
   *
   * @param key context key; must not be {@code null}
   * @param value value, or {@code null}
   */
  public static void put(String key, String value) {
    port().put(key, value);
  }

  public static void putAll(Map<String, String> entries) {
    port().putAll(entries);
  }

  public static void remove(String key) {
    port().remove(key);
  }

  public static void removeAll(Collection<String> keys) {
    port().removeAll(keys);
  }

  public static void clear() {
    port().clear();
  }

  public static boolean isEmpty() {
    return port().isEmpty();
  }

  /**
   * Unmodifiable copy of the current entries.
   *
   * @return snapshot of the map
   */
  public static Map<String, String> view() {
    return port().immutableView();
  }

  /**
   * Mutable copy of the current entries; changes do not affect the live context.
   *
   * @return detached copy
   */
  public static Map<String, String> copy() {
    return port().mutableCopy();
  }

  private static ContextMapPort port() {
    return CompositionRoot.global().contextMap();
  }
}
