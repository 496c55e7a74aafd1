package ca.gc.cra.logkit.infrastructure.exec;

import ca.gc.cra.logkit.api.LoggingContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * <strong>What:</strong> {@link ExecutorService} decorator that carries the submitter's logging context to workers.
 * <p><strong>Why:</strong> MDC map and stack are thread-local, so diagnostics set by a request thread are lost when
 * work moves to a pool.</p>
 * <p><strong>Role:</strong> Execution adapter; each task is wrapped with a {@link LoggingContext} captured on the
 * submitting thread.</p>
 * <p><strong>Thread-safety:</strong> Same as the delegate; capture happens on the submitting thread.</p>
 *
 * @implNote The worker's own context is restored after each task, so pooled threads never leak a previous task's
 * state. Lifecycle methods are delegated unchanged.
 * @since 0.1.0
 */
public class ContextPropagatingExecutorService implements ExecutorService {

  protected final ExecutorService delegate;
  private final Supplier<LoggingContext> contextSource;

  /**
   * Wraps {@code delegate}, capturing the ambient state at each submission.
   *
   * @param delegate executor running the tasks
   */
  public ContextPropagatingExecutorService(ExecutorService delegate) {
    this(delegate, LoggingContext::capture);
  }

  /**
   * Wraps {@code delegate} with a custom context source, invoked once per submitted task on the submitting thread.
   *
   * @param delegate executor running the tasks
   * @param contextSource producer of the element applied around each task
   */
  public ContextPropagatingExecutorService(ExecutorService delegate, Supplier<LoggingContext> contextSource) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.contextSource = Objects.requireNonNull(contextSource, "contextSource");
  }

  protected Runnable wrap(Runnable task) {
    return contextSource.get().wrap(Objects.requireNonNull(task, "task"));
  }

  protected <T> Callable<T> wrapCallable(Callable<T> task) {
    return contextSource.get().wrap(Objects.requireNonNull(task, "task"));
  }

  protected <T> Collection<? extends Callable<T>> wrapAll(Collection<? extends Callable<T>> tasks) {
    Objects.requireNonNull(tasks, "tasks");
    if (tasks.isEmpty()) {
      return tasks;
    }
    LoggingContext context = contextSource.get();
    List<Callable<T>> out = new ArrayList<>(tasks.size());
    for (Callable<T> task : tasks) {
      out.add(context.wrap(Objects.requireNonNull(task, "task")));
    }
    return out;
  }

  @Override
  public void execute(Runnable command) {
    delegate.execute(wrap(command));
  }

  @Override
  public void shutdown() {
    delegate.shutdown();
  }

  @Override
  public List<Runnable> shutdownNow() {
    return delegate.shutdownNow();
  }

  @Override
  public boolean isShutdown() {
    return delegate.isShutdown();
  }

  @Override
  public boolean isTerminated() {
    return delegate.isTerminated();
  }

  @Override
  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    return delegate.awaitTermination(timeout, unit);
  }

  @Override
  public <T> Future<T> submit(Callable<T> task) {
    return delegate.submit(wrapCallable(task));
  }

  @Override
  public <T> Future<T> submit(Runnable task, T result) {
    return delegate.submit(wrap(task), result);
  }

  @Override
  public Future<?> submit(Runnable task) {
    return delegate.submit(wrap(task));
  }

  @Override
  public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks) throws InterruptedException {
    return delegate.invokeAll(wrapAll(tasks));
  }

  @Override
  public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit)
      throws InterruptedException {
    return delegate.invokeAll(wrapAll(tasks), timeout, unit);
  }

  @Override
  public <T> T invokeAny(Collection<? extends Callable<T>> tasks) throws InterruptedException, ExecutionException {
    return delegate.invokeAny(wrapAll(tasks));
  }

  @Override
  public <T> T invokeAny(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit)
      throws InterruptedException, ExecutionException, TimeoutException {
    return delegate.invokeAny(wrapAll(tasks), timeout, unit);
  }

  public ExecutorService unwrap() {
    return delegate;
  }

  @Override
  public String toString() {
    return "ContextPropagatingExecutorService{" + delegate + "}";
  }
}
