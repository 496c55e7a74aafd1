package ca.gc.cra.logkit.api;

import ca.gc.cra.logkit.application.port.ContextStackPort;
import ca.gc.cra.logkit.config.CompositionRoot;
import java.util.List;
import java.util.Objects;
import org.slf4j.helpers.MessageFormatter;

/**
 * Static access to the current thread's nested diagnostic stack.
 *
 * <p>{@link #pop()} and {@link #peek()} return an empty string on an empty stack. Views list entries from the
 * bottom of the stack to the top.
 *
 * @since 0.1.0
 */
public final class ContextStack {

  private ContextStack() {}

  public static void push(String message) {
    port().push(message);
  }

  /**
   * Pushes a message formatted with SLF4J {@code {}} placeholders.
   *
   * @param pattern message pattern; must not be {@code null}
   * @param args placeholder arguments
   */
  public static void push(String pattern, Object... args) {
    Objects.requireNonNull(pattern, "pattern");
    port().push(MessageFormatter.basicArrayFormat(pattern, args));
  }

  public static String pop() {
    return port().pop();
  }

  public static String peek() {
    return port().peek();
  }

  public static int depth() {
    return port().depth();
  }

  public static boolean isEmpty() {
    return port().depth() == 0;
  }

  public static void clear() {
    port().clear();
  }

  /**
   * Discards entries from the top until at most {@code depth} remain.
   *
   * @param depth entries to keep
   * @throws IllegalArgumentException if {@code depth} is negative
   */
  public static void trim(int depth) {
    port().trim(depth);
  }

  public static List<String> view() {
    return port().immutableView();
  }

  public static List<String> copy() {
    return port().mutableCopy();
  }

  private static ContextStackPort port() {
    return CompositionRoot.global().contextStack();
  }
}
