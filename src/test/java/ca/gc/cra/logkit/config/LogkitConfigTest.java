package ca.gc.cra.logkit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class LogkitConfigTest {

  @Test
  void defaultsMatchDocumentedValues() {
    LogkitConfig defaults = LogkitConfig.defaults();

    assertEquals(100, defaults.cacheMaxEntries());
    assertEquals("NDC", defaults.contextStackKey());
    assertTrue(defaults.contextMapEnabled());
    assertTrue(defaults.contextStackEnabled());
    assertEquals(256, defaults.traceMaxParamBytes());
    assertEquals(defaults, LogkitConfig.fromMap(LogkitConfig.defaultsAsMap()));
  }

  @Test
  void fromMapParsesAndFallsBack() {
    LogkitConfig config = LogkitConfig.fromMap(Map.of(
        LogkitConfig.CACHE_MAX_ENTRIES, " 20 ",
        LogkitConfig.CONTEXT_STACK_ENABLED, "FALSE"));

    assertEquals(20, config.cacheMaxEntries());
    assertFalse(config.contextStackEnabled());
    assertTrue(config.contextMapEnabled());
    assertEquals("NDC", config.contextStackKey());
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> LogkitConfig.fromMap(Map.of(LogkitConfig.CACHE_MAX_ENTRIES, "0")));
    assertThrows(IllegalArgumentException.class,
        () -> LogkitConfig.fromMap(Map.of(LogkitConfig.CACHE_MAX_ENTRIES, "lots")));
    assertThrows(IllegalArgumentException.class,
        () -> LogkitConfig.fromMap(Map.of(LogkitConfig.CONTEXT_MAP_ENABLED, "yes")));
    assertThrows(IllegalArgumentException.class,
        () -> LogkitConfig.fromMap(Map.of(LogkitConfig.TRACE_MAX_PARAM_BYTES, "8")));
    assertThrows(IllegalArgumentException.class,
        () -> LogkitConfig.fromMap(Map.of(LogkitConfig.CONTEXT_STACK_KEY, " ")));
  }
}
