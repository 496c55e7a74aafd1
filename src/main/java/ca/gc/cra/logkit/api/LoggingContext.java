package ca.gc.cra.logkit.api;

import ca.gc.cra.logkit.application.port.ContextMapPort;
import ca.gc.cra.logkit.application.port.ContextStackPort;
import ca.gc.cra.logkit.application.port.TaskContextElement;
import ca.gc.cra.logkit.config.CompositionRoot;
import ca.gc.cra.logkit.domain.context.ContextSnapshot;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * <strong>What:</strong> Binds a {@link ContextSnapshot} to a unit of work and installs it around each run.
 * <p><strong>Why:</strong> MDC state is thread-local, so work handed to another thread, or a scope that needs
 * different diagnostics, must save, install and restore it explicitly.</p>
 * <p><strong>Role:</strong> {@link TaskContextElement} used by scoped helpers and by
 * {@code ContextPropagatingExecutorService}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>On entry, capture the ambient map and stack, then install the bound snapshot.</li>
 *   <li>On exit, reinstate exactly what was captured on entry, whatever the work changed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Instances are immutable and may be applied on several threads; each
 * {@link #updateContext()}/{@link #restoreContext(ContextSnapshot)} pair must run on one thread.</p>
 *
 * @implNote Installing a snapshot replaces the map before the stack. An absent component clears the
 * corresponding ambient part.
 * @since 0.1.0
 */
public final class LoggingContext implements TaskContextElement<ContextSnapshot> {
  private final ContextSnapshot snapshot;
  private final ContextMapPort map;
  private final ContextStackPort stack;

  /**
   * Binds {@code snapshot} to explicit ambient ports.
   *
   * @param snapshot state installed on entry; must not be {@code null}
   * @param map context map port
   * @param stack context stack port
   */
  public LoggingContext(ContextSnapshot snapshot, ContextMapPort map, ContextStackPort stack) {
    this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
    this.map = Objects.requireNonNull(map, "map");
    this.stack = Objects.requireNonNull(stack, "stack");
  }

  /**
   * Binds the calling thread's current map and stack.
   *
   * @return element reproducing the current ambient state
   */
  public static LoggingContext capture() {
    CompositionRoot root = CompositionRoot.global();
    return new LoggingContext(current(root.contextMap(), root.contextStack()), root.contextMap(), root.contextStack());
  }

  public static LoggingContext of(ContextSnapshot snapshot) {
    CompositionRoot root = CompositionRoot.global();
    return new LoggingContext(snapshot, root.contextMap(), root.contextStack());
  }

  /**
   * Binds exactly {@code map} and {@code stack}; ambient entries not listed are hidden while the element is applied.
   *
   * @param map entries to install; {@code null} installs an empty map
   * @param stack stack entries bottom first; {@code null} installs an empty stack
   * @return replacing element
   * @throws NullPointerException if {@code map} has a {@code null} key or {@code stack} a {@code null} entry
   */
  public static LoggingContext replace(Map<String, String> map, Collection<String> stack) {
    return of(ContextSnapshot.of(map == null ? Map.of() : map, stack == null ? List.of() : stack));
  }

  /**
   * Binds the calling thread's current state with {@code map} merged on top and {@code stack} pushed above it.
   * The ambient state is read now, not when the element is applied.
   *
   * @param map entries to add; values win over ambient values for the same key; {@code null} adds nothing
   * @param stack entries to push, bottom first; {@code null} adds nothing
   * @return augmenting element
   * @throws NullPointerException if {@code map} has a {@code null} key or {@code stack} a {@code null} entry
   */
  public static LoggingContext augment(Map<String, String> map, Collection<String> stack) {
    CompositionRoot root = CompositionRoot.global();
    ContextSnapshot ambient = current(root.contextMap(), root.contextStack());
    return new LoggingContext(ambient.overlay(map, stack), root.contextMap(), root.contextStack());
  }

  public static LoggingContext empty() {
    return of(ContextSnapshot.EMPTY);
  }

  /**
   * Runs {@code block} with exactly {@code map} and {@code stack} installed, restoring the prior state afterwards.
   *
   * @param map entries to install
   * @param stack stack entries bottom first
   * @param block work to run
   * @param <R> result type
   * @return value produced by {@code block}
   * @throws Exception whatever {@code block} throws
   */
  public static <R> R withLoggingContext(Map<String, String> map, Collection<String> stack, Callable<R> block)
      throws Exception {
    return replace(map, stack).call(block);
  }

  public static void withLoggingContext(Map<String, String> map, Collection<String> stack, Runnable block) {
    replace(map, stack).run(block);
  }

  /**
   * Runs {@code block} with {@code map} and {@code stack} added to the current state, restoring it afterwards.
   *
   * @param map entries to add
   * @param stack entries to push, bottom first
   * @param block work to run
   * @param <R> result type
   * @return value produced by {@code block}
   * @throws Exception whatever {@code block} throws
   */
  public static <R> R withAdditionalLoggingContext(
      Map<String, String> map, Collection<String> stack, Callable<R> block) throws Exception {
    return augment(map, stack).call(block);
  }

  public static void withAdditionalLoggingContext(
      Map<String, String> map, Collection<String> stack, Runnable block) {
    augment(map, stack).run(block);
  }

  /**
   * State installed by {@link #updateContext()}.
   *
   * @return bound snapshot
   */
  public ContextSnapshot snapshot() {
    return snapshot;
  }

  /**
   * Installs the bound snapshot and returns the state it replaced.
   *
   * <p>If installing fails, the replaced state is reinstated before the failure propagates, so the caller never
   * observes a partly installed scope.
   *
   * @return state active before the call
   */
  @Override
  public ContextSnapshot updateContext() {
    ContextSnapshot prior = current(map, stack);
    try {
      install(snapshot);
    } catch (RuntimeException | Error e) {
      install(prior);
      throw e;
    }
    return prior;
  }

  @Override
  public void restoreContext(ContextSnapshot previous) {
    install(Objects.requireNonNull(previous, "previous"));
  }

  /**
   * Runs {@code block} with this element applied on the calling thread.
   *
   * @param block work to run
   * @param <R> result type
   * @return value produced by {@code block}
   * @throws Exception whatever {@code block} throws
   */
  public <R> R call(Callable<R> block) throws Exception {
    Objects.requireNonNull(block, "block");
    ContextSnapshot prior = updateContext();
    try {
      return block.call();
    } finally {
      restoreContext(prior);
    }
  }

  public void run(Runnable block) {
    Objects.requireNonNull(block, "block");
    ContextSnapshot prior = updateContext();
    try {
      block.run();
    } finally {
      restoreContext(prior);
    }
  }

  /**
   * Returns a task that applies this element on whichever thread runs it.
   *
   * @param task task to wrap
   * @return wrapping task
   */
  public Runnable wrap(Runnable task) {
    Objects.requireNonNull(task, "task");
    return () -> run(task);
  }

  public <R> Callable<R> wrap(Callable<R> task) {
    Objects.requireNonNull(task, "task");
    return () -> call(task);
  }

  private void install(ContextSnapshot target) {
    map.clear();
    if (target.hasMap()) {
      map.putAll(target.map());
    }
    if (target.hasStack()) {
      stack.setAll(target.stack());
    } else {
      stack.clear();
    }
  }

  private static ContextSnapshot current(ContextMapPort map, ContextStackPort stack) {
    return new ContextSnapshot(map.immutableView(), stack.immutableView());
  }

  @Override
  public String toString() {
    return "LoggingContext{" + snapshot + "}";
  }
}
