package ca.gc.cra.logkit.sample;

import ca.gc.cra.logkit.api.ContextMap;
import ca.gc.cra.logkit.api.ContextStack;
import ca.gc.cra.logkit.api.FunctionalLogger;
import ca.gc.cra.logkit.api.LazyLogger;
import ca.gc.cra.logkit.api.Logging;
import ca.gc.cra.logkit.api.LoggingContext;
import ca.gc.cra.logkit.domain.level.Level;
import ca.gc.cra.logkit.infrastructure.exec.ContextPropagatingExecutorService;
import ca.gc.cra.logkit.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.logkit.logging.LoggingConfigurator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Demonstrates the logkit facade end to end: deferred messages, traced blocks, context scopes and propagation.
 *
 * <p>Run with {@code -Dsample.level=INFO} to watch the TRACE events disappear.
 */
public final class LoggingApp implements Logging {
  private static final LazyLogger LOG = LazyLogger.forClass(LoggingApp.class);

  public static void main(String[] args) throws Exception {
    Level level = Level.parse(System.getProperty("sample.level", "TRACE"));
    LoggingConfigurator.setLevel(LoggingApp.class.getName(), level);
    new LoggingApp().run();
  }

  void run() throws Exception {
    FunctionalLogger log = LOG.get();
    String s1 = "foo";
    String s2 = "bar";

    log.info(() -> "Hello, world: " + s1 + " " + s2);
    log.trace("Regular trace");

    log.runInTrace(() -> log.info("Inside traced block"));

    Supplier<?> first = () -> "param1";
    Supplier<?> second = () -> "param2";
    log.runInTrace(log.traceEntry(first, second), () -> log.info("Inside traced block with parameter suppliers"));

    log.info(() -> "Key was " + key());
    try {
      log.info(() -> "Key was " + failingKey());
    } catch (IllegalStateException e) {
      log.info(() -> "Key threw " + e.getMessage());
    }

    ContextMap.put("user", "alice");
    ContextStack.push("request-{}", 42);
    LoggingContext.withAdditionalLoggingContext(Map.of("step", "checkout"), List.of("payment"), () -> {
      log().info(() -> "Context inside scope: " + ContextMap.view() + " " + ContextStack.view());
    });
    log().info(() -> "Context after scope: " + ContextMap.view() + " " + ContextStack.view());

    ContextPropagatingExecutorService pool = ExecutorFactories.newContextPropagatingPool(2, "sample", null);
    try {
      pool.submit(() -> log().info(() -> "Worker sees " + ContextMap.get("user"))).get(5, TimeUnit.SECONDS);
    } finally {
      pool.shutdown();
      pool.awaitTermination(5, TimeUnit.SECONDS);
    }
    ContextMap.clear();
    ContextStack.clear();
  }

  private int key() {
    Callable<Integer> block = () -> ThreadLocalRandom.current().nextInt(10);
    return LOG.get().runInTrace(block);
  }

  private int failingKey() {
    Callable<Integer> block = () -> {
      throw new IllegalStateException("Oops!");
    };
    return LOG.get().runInTrace(block);
  }
}
