package ca.gc.cra.logkit.domain.context;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ContextSnapshotTest {

  @Test
  void componentsAreDefensivelyCopied() {
    Map<String, String> map = new HashMap<>(Map.of("k", "v"));
    List<String> stack = new ArrayList<>(List.of("a"));
    ContextSnapshot snapshot = ContextSnapshot.of(map, stack);

    map.put("k", "changed");
    stack.add("b");

    assertEquals(Map.of("k", "v"), snapshot.map());
    assertEquals(List.of("a"), snapshot.stack());
    assertThrows(UnsupportedOperationException.class, () -> snapshot.stack().add("c"));
  }

  @Test
  void absentComponentsStayAbsent() {
    assertNull(ContextSnapshot.ABSENT.map());
    assertFalse(ContextSnapshot.ABSENT.hasMap());
    assertFalse(ContextSnapshot.ABSENT.hasStack());
    assertTrue(ContextSnapshot.EMPTY.hasMap());
  }

  @Test
  void overlayMergesMapAndAppendsStack() {
    ContextSnapshot base = ContextSnapshot.of(Map.of("a", "1", "b", "2"), List.of("x"));

    ContextSnapshot merged = base.overlay(Map.of("b", "20", "c", "3"), List.of("y", "z"));

    assertEquals(Map.of("a", "1", "b", "20", "c", "3"), merged.map());
    assertEquals(List.of("x", "y", "z"), merged.stack());
  }

  @Test
  void overlayOnAbsentTreatsItAsEmpty() {
    ContextSnapshot merged = ContextSnapshot.ABSENT.overlay(null, List.of("only"));

    assertEquals(Map.of(), merged.map());
    assertEquals(List.of("only"), merged.stack());
  }

  @Test
  void nullStackEntriesAndMapKeysAreRejected() {
    Map<String, String> nullKey = new HashMap<>();
    nullKey.put(null, "v");

    assertThrows(NullPointerException.class, () -> ContextSnapshot.of(Map.of(), Arrays.asList("a", null)));
    assertThrows(NullPointerException.class, () -> ContextSnapshot.of(nullKey, List.of()));
    assertThrows(NullPointerException.class,
        () -> ContextSnapshot.EMPTY.overlay(Map.of(), Arrays.asList((String) null)));
  }
}
