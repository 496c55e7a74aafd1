package ca.gc.cra.logkit.infrastructure.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fixed-size, insertion-ordered cache of logger adapters keyed by owner.
 * <p><strong>Why:</strong> Owner-to-name resolution and channel lookup run once per owner instead of once per call
 * site, while the number of retained adapters stays bounded.</p>
 * <p><strong>Role:</strong> Backing store of {@code Loggers#cachedLoggerOf(Class)} and the {@code Logging} mixin.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Evict the least-recently-inserted entry once {@code maxEntries} is exceeded.</li>
 *   <li>Construct at most one value per key, even under concurrent lookups.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All access is serialized on an internal lock; values are built under that lock.</p>
 * <p><strong>Performance:</strong> O(1) lookups; value construction must stay cheap because it blocks other lookups.</p>
 *
 * @param <K> key type, typically {@code Class<?>}
 * @param <V> cached value type
 * @since 0.1.0
 */
public final class BoundedLoggerCache<K, V> {
  private static final Logger log = LoggerFactory.getLogger(BoundedLoggerCache.class);

  private final Object lock = new Object();
  private final int maxEntries;
  private final Map<K, V> entries;
  private long evictions;

  /**
   * Creates a cache holding at most {@code maxEntries} values.
   *
   * @param maxEntries upper bound on retained entries; must be positive
   * @throws IllegalArgumentException if {@code maxEntries} is not positive
   */
  public BoundedLoggerCache(int maxEntries) {
    if (maxEntries <= 0) {
      throw new IllegalArgumentException("maxEntries must be positive");
    }
    this.maxEntries = maxEntries;
    this.entries = new LinkedHashMap<>(Math.min(maxEntries, 256), 1f) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
        if (size() > BoundedLoggerCache.this.maxEntries) {
          evictions++;
          log.debug("Evicting cached logger for {} (bound {})", eldest.getKey(), BoundedLoggerCache.this.maxEntries);
          return true;
        }
        return false;
      }
    };
  }

  /**
   * Returns the cached value for {@code key}, building it with {@code factory} when absent.
   *
   * @param key cache key; must not be {@code null}
   * @param factory builder invoked at most once per absent key; must not return {@code null}
   * @return cached or newly built value
   */
  public V computeIfAbsent(K key, Function<? super K, ? extends V> factory) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(factory, "factory");
    synchronized (lock) {
      V existing = entries.get(key);
      if (existing != null) {
        return existing;
      }
      V created = Objects.requireNonNull(factory.apply(key), "factory returned null");
      entries.put(key, created);
      return created;
    }
  }

  /**
   * Returns the cached value for {@code key} without building one.
   *
   * @param key cache key
   * @return cached value, or {@code null}
   */
  public V getIfPresent(K key) {
    synchronized (lock) {
      return entries.get(key);
    }
  }

  public boolean containsKey(K key) {
    synchronized (lock) {
      return entries.containsKey(key);
    }
  }

  public int size() {
    synchronized (lock) {
      return entries.size();
    }
  }

  public int maxEntries() {
    return maxEntries;
  }

  /**
   * Number of entries evicted since construction.
   *
   * @return eviction count
   */
  public long evictions() {
    synchronized (lock) {
      return evictions;
    }
  }

  public void clear() {
    synchronized (lock) {
      entries.clear();
    }
  }
}
