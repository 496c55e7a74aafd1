package ca.gc.cra.logkit.infrastructure.slf4j;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class MdcContextMapTest {
  private final MdcContextStack stack = new MdcContextStack("TRAIL");
  private final MdcContextMap map = new MdcContextMap("TRAIL");

  @AfterEach
  void tearDown() {
    MDC.getMDCAdapter().clearDequeByKey("TRAIL");
    MDC.clear();
  }

  @Test
  void stackEntryIsHiddenFromMapReads() {
    stack.push("frame");
    map.put("user", "alice");

    assertEquals(Map.of("user", "alice"), map.immutableView());
    assertEquals(Map.of("user", "alice"), map.mutableCopy());
    assertNull(map.get("TRAIL"));
    assertFalse(map.containsKey("TRAIL"));
    assertEquals("frame", MDC.get("TRAIL"));
  }

  @Test
  void clearKeepsStackEntry() {
    stack.push("frame");
    map.put("user", "alice");

    map.clear();

    assertTrue(map.isEmpty());
    assertNull(MDC.get("user"));
    assertEquals("frame", MDC.get("TRAIL"));
    assertEquals(List.of("frame"), stack.immutableView());
  }

  @Test
  void stackEntryCannotBeWrittenThroughMap() {
    assertThrows(IllegalArgumentException.class, () -> map.put("TRAIL", "forged"));
    assertThrows(IllegalArgumentException.class, () -> map.remove("TRAIL"));
  }

  @Test
  void unreservedMapSeesWholeMdc() {
    MdcContextMap plain = new MdcContextMap();
    stack.push("frame");

    assertEquals(Map.of("TRAIL", "frame"), plain.immutableView());
  }
}
