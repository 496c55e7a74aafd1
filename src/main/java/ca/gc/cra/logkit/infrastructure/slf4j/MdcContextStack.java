package ca.gc.cra.logkit.infrastructure.slf4j;

import ca.gc.cra.logkit.application.port.ContextStackPort;
import ca.gc.cra.logkit.validation.Strings;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.MDC;
import org.slf4j.spi.MDCAdapter;

/**
 * <strong>What:</strong> {@link ContextStackPort} stored in an SLF4J MDC deque under a fixed key.
 * <p><strong>Why:</strong> SLF4J 2 exposes keyed deques ({@code pushByKey}/{@code popByKey}) but no stand-alone
 * nested diagnostic context; one deque key plays that role.</p>
 * <p><strong>Role:</strong> Engine adapter wired by {@code CompositionRoot} with the configured stack key.</p>
 * <p><strong>Thread-safety:</strong> Deques are thread-local inside the MDC adapter.</p>
 *
 * <p>Logback does not copy MDC deques into logging events, so every change also writes the rendered stack,
 * bottom first and space separated, into the MDC map under the same key. Patterns such as {@code %X{NDC}}
 * and asynchronous appenders see it like any other map entry; an empty stack removes the entry.</p>
 *
 * @implNote The MDC deque keeps the top entry first; views returned here are reversed to list the bottom first.
 * Popping an empty deque is guarded because some adapters throw on it.
 * @since 0.1.0
 */
public final class MdcContextStack implements ContextStackPort {
  private final String key;

  /**
   * Creates a stack stored under the given MDC deque key.
   *
   * @param key deque key, for example {@code NDC}
   * @throws IllegalArgumentException if {@code key} is blank
   */
  public MdcContextStack(String key) {
    this.key = Strings.requireNonBlank("contextStackKey", key);
  }

  /**
   * MDC deque key used by this stack.
   *
   * @return deque key
   */
  public String key() {
    return key;
  }

  @Override
  public void push(String message) {
    MDCAdapter adapter = adapter();
    adapter.pushByKey(key, Objects.requireNonNull(message, "message"));
    mirror(adapter);
  }

  @Override
  public String pop() {
    if (depth() == 0) {
      return "";
    }
    MDCAdapter adapter = adapter();
    String value = adapter.popByKey(key);
    mirror(adapter);
    return value == null ? "" : value;
  }

  @Override
  public String peek() {
    Deque<String> copy = adapter().getCopyOfDequeByKey(key);
    if (copy == null || copy.isEmpty()) {
      return "";
    }
    String top = copy.peekFirst();
    return top == null ? "" : top;
  }

  @Override
  public int depth() {
    Deque<String> copy = adapter().getCopyOfDequeByKey(key);
    return copy == null ? 0 : copy.size();
  }

  @Override
  public void clear() {
    MDCAdapter adapter = adapter();
    adapter.clearDequeByKey(key);
    adapter.remove(key);
  }

  @Override
  public void setAll(Collection<String> messages) {
    Objects.requireNonNull(messages, "messages");
    for (String message : messages) {
      Objects.requireNonNull(message, "stack entry");
    }
    MDCAdapter adapter = adapter();
    adapter.clearDequeByKey(key);
    for (String message : messages) {
      adapter.pushByKey(key, message);
    }
    mirror(adapter);
  }

  @Override
  public void trim(int depth) {
    if (depth < 0) {
      throw new IllegalArgumentException("depth must not be negative");
    }
    int excess = depth() - depth;
    MDCAdapter adapter = adapter();
    for (int i = 0; i < excess; i++) {
      adapter.popByKey(key);
    }
    mirror(adapter);
  }

  @Override
  public List<String> immutableView() {
    return Collections.unmodifiableList(mutableCopy());
  }

  @Override
  public List<String> mutableCopy() {
    Deque<String> copy = adapter().getCopyOfDequeByKey(key);
    List<String> bottomFirst = new ArrayList<>(copy == null ? 0 : copy.size());
    if (copy != null) {
      Iterator<String> it = copy.descendingIterator();
      while (it.hasNext()) {
        bottomFirst.add(it.next());
      }
    }
    return bottomFirst;
  }

  /**
   * Renders the stack for appenders.
   *
   * @return entries bottom first joined by a single space; empty when the stack is empty
   */
  public String render() {
    return render(adapter().getCopyOfDequeByKey(key));
  }

  private void mirror(MDCAdapter adapter) {
    String rendered = render(adapter.getCopyOfDequeByKey(key));
    if (rendered.isEmpty()) {
      adapter.remove(key);
    } else {
      adapter.put(key, rendered);
    }
  }

  private static String render(Deque<String> topFirst) {
    if (topFirst == null || topFirst.isEmpty()) {
      return "";
    }
    StringJoiner joiner = new StringJoiner(" ");
    Iterator<String> it = topFirst.descendingIterator();
    while (it.hasNext()) {
      joiner.add(it.next());
    }
    return joiner.toString();
  }

  private static MDCAdapter adapter() {
    return MDC.getMDCAdapter();
  }
}
