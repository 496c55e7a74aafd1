package ca.gc.cra.logkit.application.port;

/**
 * <strong>What:</strong> Element a task scheduler applies around each run of a task on a worker thread.
 * <p><strong>Why:</strong> Thread-local state does not follow a task across thread hand-offs; the scheduler calls
 * {@link #updateContext()} before the task runs and {@link #restoreContext(Object)} when it suspends or completes.</p>
 * <p><strong>Role:</strong> Port implemented by {@code LoggingContext} and driven by
 * {@code ContextPropagatingExecutorService} or by scoped helpers.</p>
 * <p><strong>Thread-safety:</strong> Both calls of a pair happen on the same thread, strictly nested with any other
 * element applied on that thread.</p>
 *
 * @param <S> type of the state handed from {@link #updateContext()} to {@link #restoreContext(Object)}
 * @since 0.1.0
 */
public interface TaskContextElement<S> {

  /**
   * Installs this element's state on the current thread.
   *
   * @return state that was active before the call; must be passed to the matching {@link #restoreContext(Object)}
   */
  S updateContext();

  /**
   * Reinstates the state returned by the matching {@link #updateContext()} call.
   *
   * @param previous value returned by {@link #updateContext()}
   */
  void restoreContext(S previous);
}
