package ca.gc.cra.logkit.domain.context;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable capture of ambient logging state: the context map and the context stack.
 * <p><strong>Why:</strong> Ambient state must be saved before a scope installs its own values and reinstated
 * afterwards, regardless of what the scope changed.</p>
 * <p><strong>Role:</strong> Domain value exchanged between {@code LoggingContext} entry and exit callbacks.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold a defensive, unmodifiable copy of the map and the stack (bottom entry first).</li>
 *   <li>Represent an absent component as {@code null}; installing an absent component clears it.</li>
 *   <li>Reject {@code null} map keys and {@code null} stack entries up front, so installing never fails halfway.</li>
 *   <li>Derive additive overlays for nested "augment" scopes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to hand between threads.</p>
 *
 * @param map context map entries, or {@code null} when this snapshot does not carry a map
 * @param stack context stack entries from bottom to top, or {@code null} when this snapshot does not carry a stack
 * @since 0.1.0
 */
public record ContextSnapshot(Map<String, String> map, List<String> stack) {

  /** Snapshot with an empty map and an empty stack. */
  public static final ContextSnapshot EMPTY = new ContextSnapshot(Map.of(), List.of());

  /** Snapshot carrying neither component; installing it clears both. */
  public static final ContextSnapshot ABSENT = new ContextSnapshot(null, null);

  /**
   * Copies both components.
   *
   * @throws NullPointerException if the map has a {@code null} key or the stack a {@code null} entry
   */
  public ContextSnapshot {
    if (map != null) {
      Map<String, String> copy = new LinkedHashMap<>(map);
      for (String key : copy.keySet()) {
        Objects.requireNonNull(key, "context map key");
      }
      map = Collections.unmodifiableMap(copy);
    }
    if (stack != null) {
      List<String> copy = new ArrayList<>(stack);
      for (String entry : copy) {
        Objects.requireNonNull(entry, "context stack entry");
      }
      stack = Collections.unmodifiableList(copy);
    }
  }

  /**
   * Creates a snapshot from arbitrary collections, copying them.
   *
   * @param map map entries; {@code null} for absent
   * @param stack stack entries bottom first; {@code null} for absent
   * @return new snapshot
   */
  public static ContextSnapshot of(Map<String, String> map, Collection<String> stack) {
    return new ContextSnapshot(map, stack == null ? null : new ArrayList<>(stack));
  }

  /**
   * Indicates whether this snapshot carries a map component.
   *
   * @return {@code true} when {@link #map()} is non-null
   */
  public boolean hasMap() {
    return map != null;
  }

  /**
   * Indicates whether this snapshot carries a stack component.
   *
   * @return {@code true} when {@link #stack()} is non-null
   */
  public boolean hasStack() {
    return stack != null;
  }

  /**
   * Returns a snapshot with {@code extraMap} merged over this map and {@code extraStack} appended to this stack.
   * Absent components of this snapshot are treated as empty; overlay values win on key clashes.
   *
   * @param extraMap entries to add; {@code null} adds nothing
   * @param extraStack entries to push, bottom first; {@code null} adds nothing
   * @return merged snapshot carrying both components
   */
  public ContextSnapshot overlay(Map<String, String> extraMap, Collection<String> extraStack) {
    Map<String, String> mergedMap = new LinkedHashMap<>();
    if (map != null) {
      mergedMap.putAll(map);
    }
    if (extraMap != null) {
      mergedMap.putAll(extraMap);
    }
    List<String> mergedStack = new ArrayList<>();
    if (stack != null) {
      mergedStack.addAll(stack);
    }
    if (extraStack != null) {
      mergedStack.addAll(extraStack);
    }
    return new ContextSnapshot(mergedMap, mergedStack);
  }
}
