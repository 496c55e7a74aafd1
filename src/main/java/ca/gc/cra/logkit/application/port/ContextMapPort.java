package ca.gc.cra.logkit.application.port;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * <strong>What:</strong> Port over the engine's thread-local key/value context.
 * <p><strong>Why:</strong> The facade reads and writes ambient state without owning its storage.</p>
 * <p><strong>Role:</strong> Implemented by {@code MdcContextMap}; {@link #DISABLED} stands in when the map is switched off.</p>
 * <p><strong>Thread-safety:</strong> Operations act on the calling thread's context only.</p>
 *
 * @since 0.1.0
 */
public interface ContextMapPort {

  String get(String key);

  boolean containsKey(String key);

  /**
   * Puts a value; a {@code null} value removes the key.
   *
   * @param key context key; must not be {@code null}
   * @param value value or {@code null}
   */
  void put(String key, String value);

  void putAll(Map<String, String> entries);

  void remove(String key);

  void removeAll(Collection<String> keys);

  void clear();

  boolean isEmpty();

  /**
   * Unmodifiable copy of the current context map.
   *
   * @return current entries; empty when disabled
   */
  Map<String, String> immutableView();

  /**
   * Mutable copy of the current context map, detached from the live context.
   *
   * @return new map owned by the caller
   */
  Map<String, String> mutableCopy();

  /**
   * Context map that reads as empty and ignores writes.
   */
  ContextMapPort DISABLED = new ContextMapPort() {
    @Override public String get(String key) {
      return null;
    }

    @Override public boolean containsKey(String key) {
      return false;
    }

    @Override public void put(String key, String value) {}

    @Override public void putAll(Map<String, String> entries) {}

    @Override public void remove(String key) {}

    @Override public void removeAll(Collection<String> keys) {}

    @Override public void clear() {}

    @Override public boolean isEmpty() {
      return true;
    }

    @Override public Map<String, String> immutableView() {
      return Map.of();
    }

    @Override public Map<String, String> mutableCopy() {
      return new HashMap<>();
    }
  };
}
