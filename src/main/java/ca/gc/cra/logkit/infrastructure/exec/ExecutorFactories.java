package ca.gc.cra.logkit.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for executors whose tasks inherit the submitter's logging context.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size, context-propagating pool with named daemon threads.
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix; blank selects {@code logkit-worker}
   * @param handler uncaught exception handler installed on each worker; {@code null} logs at ERROR
   * @return executor that applies the submitter's context around every task
   */
  public static ContextPropagatingExecutorService newContextPropagatingPool(
      int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "logkit-worker" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(
        handler, (t, ex) -> log.error("Uncaught exception in {}", t.getName(), ex));
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    ExecutorService pool = new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
    return new ContextPropagatingExecutorService(pool);
  }
}
