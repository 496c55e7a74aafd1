package ca.gc.cra.logkit.application.port;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * <strong>What:</strong> Port over the engine's thread-local stack of diagnostic strings.
 * <p><strong>Why:</strong> Nested diagnostic context (NDC style) is read and written by the facade without owning it.</p>
 * <p><strong>Role:</strong> Implemented by {@code MdcContextStack}; {@link #DISABLED} stands in when the stack is switched off.</p>
 * <p><strong>Thread-safety:</strong> Operations act on the calling thread's stack only.</p>
 * <p>Views and copies list entries from the bottom of the stack to the top.</p>
 *
 * @since 0.1.0
 */
public interface ContextStackPort {

  void push(String message);

  /**
   * Removes and returns the top entry.
   *
   * @return top entry, or an empty string when the stack is empty or disabled
   */
  String pop();

  /**
   * Returns the top entry without removing it.
   *
   * @return top entry, or an empty string when the stack is empty or disabled
   */
  String peek();

  int depth();

  void clear();

  /**
   * Replaces the stack with {@code messages}, the first element becoming the bottom.
   *
   * @param messages new stack content; must not be {@code null}
   */
  void setAll(Collection<String> messages);

  /**
   * Trims the stack to at most {@code depth} entries, discarding from the top.
   *
   * @param depth maximum depth to keep; negative values are rejected
   * @throws IllegalArgumentException if {@code depth} is negative
   */
  void trim(int depth);

  /**
   * Unmodifiable copy of the stack.
   *
   * @return entries bottom first; empty when disabled
   */
  List<String> immutableView();

  /**
   * Mutable copy of the stack, detached from the live context.
   *
   * @return new list owned by the caller, bottom first
   */
  List<String> mutableCopy();

  /**
   * Context stack that reads as empty and ignores writes.
   */
  ContextStackPort DISABLED = new ContextStackPort() {
    @Override public void push(String message) {}

    @Override public String pop() {
      return "";
    }

    @Override public String peek() {
      return "";
    }

    @Override public int depth() {
      return 0;
    }

    @Override public void clear() {}

    @Override public void setAll(Collection<String> messages) {}

    @Override public void trim(int depth) {
      if (depth < 0) {
        throw new IllegalArgumentException("depth must not be negative");
      }
    }

    @Override public List<String> immutableView() {
      return List.of();
    }

    @Override public List<String> mutableCopy() {
      return new ArrayList<>();
    }
  };
}
