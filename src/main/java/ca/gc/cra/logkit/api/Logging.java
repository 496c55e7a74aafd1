package ca.gc.cra.logkit.api;

/**
 * Mixin that gives implementing classes a cached logger named after their runtime class.
 *
 * <pre>{@code
 * final class OrderService implements Logging {
 *   void place(Order order) {
 *     log().info(() -> "placing " + order);
 *   }
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public interface Logging {

  /**
   * Logger for this object's runtime class, subject to the {@link Companion} rule.
   *
   * @return cached facade
   */
  default FunctionalLogger log() {
    return Loggers.cachedLoggerOf(getClass());
  }
}
