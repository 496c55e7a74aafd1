package ca.gc.cra.logkit.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("abc", Logs.truncate("abc", 16));
    assertEquals("null", Logs.truncate(null, 16));
  }

  @Test
  void longValuesCarryLengthMetadata() {
    assertEquals("abcd... (truncated, 4 of 10)", Logs.truncate("abcdefghij", 4));
  }

  @Test
  void truncationNeverSplitsMultiByteCharacters() {
    String text = "ééé";
    String truncated = Logs.truncate(text, 3);

    assertTrue(truncated.startsWith("é... (truncated, 3 of 6)"));
    assertEquals(6, text.getBytes(StandardCharsets.UTF_8).length);
  }

  @Test
  void renderExpandsNestedArrays() {
    assertEquals("[1, [a, b]]", Logs.render(new Object[] {1, new String[] {"a", "b"}}, 64));
    assertEquals("42", Logs.render(42, 64));
  }

  @Test
  void rejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
