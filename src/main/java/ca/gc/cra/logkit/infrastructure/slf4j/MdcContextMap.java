package ca.gc.cra.logkit.infrastructure.slf4j;

import ca.gc.cra.logkit.application.port.ContextMapPort;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> {@link ContextMapPort} over the SLF4J {@link MDC} map.
 * <p><strong>Why:</strong> Values placed through the facade surface in appender patterns such as {@code %X{key}}.</p>
 * <p><strong>Thread-safety:</strong> MDC storage is thread-local; this adapter holds no state beyond its reserved key.</p>
 * <p>An optional reserved key names the entry {@link MdcContextStack} writes for appenders. That entry is left out of
 * views, copies, lookups and {@link #isEmpty()}, survives {@link #clear()}, and cannot be written through this map.</p>
 *
 * @since 0.1.0
 */
public final class MdcContextMap implements ContextMapPort {
  private final String reservedKey;

  /** Creates a map over the whole MDC. */
  public MdcContextMap() {
    this.reservedKey = null;
  }

  /**
   * Creates a map that hides the entry owned by the context stack.
   *
   * @param reservedKey MDC key written by {@link MdcContextStack}; must not be {@code null}
   */
  public MdcContextMap(String reservedKey) {
    this.reservedKey = Objects.requireNonNull(reservedKey, "reservedKey");
  }

  @Override
  public String get(String key) {
    Objects.requireNonNull(key, "key");
    return key.equals(reservedKey) ? null : MDC.get(key);
  }

  @Override
  public boolean containsKey(String key) {
    return get(key) != null;
  }

  @Override
  public void put(String key, String value) {
    requireWritable(key);
    if (value == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, value);
    }
  }

  @Override
  public void putAll(Map<String, String> entries) {
    Objects.requireNonNull(entries, "entries");
    for (Map.Entry<String, String> entry : entries.entrySet()) {
      put(entry.getKey(), entry.getValue());
    }
  }

  @Override
  public void remove(String key) {
    requireWritable(key);
    MDC.remove(key);
  }

  @Override
  public void removeAll(Collection<String> keys) {
    Objects.requireNonNull(keys, "keys");
    for (String key : keys) {
      remove(key);
    }
  }

  @Override
  public void clear() {
    String kept = reservedKey == null ? null : MDC.get(reservedKey);
    MDC.clear();
    if (kept != null) {
      MDC.put(reservedKey, kept);
    }
  }

  @Override
  public boolean isEmpty() {
    return mutableCopy().isEmpty();
  }

  @Override
  public Map<String, String> immutableView() {
    Map<String, String> current = mutableCopy();
    if (current.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(current);
  }

  @Override
  public Map<String, String> mutableCopy() {
    Map<String, String> current = MDC.getCopyOfContextMap();
    Map<String, String> copy = current == null ? new HashMap<>() : new HashMap<>(current);
    if (reservedKey != null) {
      copy.remove(reservedKey);
    }
    return copy;
  }

  private void requireWritable(String key) {
    Objects.requireNonNull(key, "key");
    if (key.equals(reservedKey)) {
      throw new IllegalArgumentException("MDC key " + key + " is reserved for the context stack");
    }
  }
}
