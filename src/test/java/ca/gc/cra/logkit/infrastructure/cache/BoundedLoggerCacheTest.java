package ca.gc.cra.logkit.infrastructure.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class BoundedLoggerCacheTest {

  @Test
  void evictsInInsertionOrderWhenFull() {
    BoundedLoggerCache<String, String> cache = new BoundedLoggerCache<>(2);
    cache.computeIfAbsent("a", k -> "A");
    cache.computeIfAbsent("b", k -> "B");
    cache.computeIfAbsent("a", k -> "A2");
    cache.computeIfAbsent("c", k -> "C");

    assertFalse(cache.containsKey("a"));
    assertTrue(cache.containsKey("b"));
    assertTrue(cache.containsKey("c"));
    assertEquals(2, cache.size());
    assertEquals(1, cache.evictions());
  }

  @Test
  void factoryRunsOnlyForMissingKeys() {
    AtomicInteger builds = new AtomicInteger();
    BoundedLoggerCache<String, Integer> cache = new BoundedLoggerCache<>(10);

    cache.computeIfAbsent("k", k -> builds.incrementAndGet());
    cache.computeIfAbsent("k", k -> builds.incrementAndGet());

    assertEquals(1, builds.get());
    assertEquals(Integer.valueOf(1), cache.getIfPresent("k"));
    assertNull(cache.getIfPresent("other"));
  }

  @Test
  void concurrentLookupsBuildOncePerKey() throws Exception {
    AtomicInteger builds = new AtomicInteger();
    BoundedLoggerCache<Integer, Object> cache = new BoundedLoggerCache<>(100);
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < 8; t++) {
        futures.add(pool.submit(() -> {
          start.await();
          for (int key = 0; key < 50; key++) {
            cache.computeIfAbsent(key, k -> {
              builds.incrementAndGet();
              return new Object();
            });
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(50, builds.get());
    assertEquals(50, cache.size());
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> new BoundedLoggerCache<String, String>(0));
    BoundedLoggerCache<String, String> cache = new BoundedLoggerCache<>(1);
    assertThrows(NullPointerException.class, () -> cache.computeIfAbsent("k", k -> null));
    assertThrows(NullPointerException.class, () -> cache.computeIfAbsent(null, k -> "v"));
  }

  @Test
  void clearDropsEntries() {
    BoundedLoggerCache<String, String> cache = new BoundedLoggerCache<>(3);
    cache.computeIfAbsent("a", k -> "A");
    cache.clear();

    assertEquals(0, cache.size());
    assertEquals(3, cache.maxEntries());
  }
}
