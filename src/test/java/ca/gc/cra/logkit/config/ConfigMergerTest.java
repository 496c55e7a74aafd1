package ca.gc.cra.logkit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void systemPropertiesOverrideYamlAndEmitWarning() {
    Map<String, String> defaults = Map.of("cache.maxEntries", "100", "context.stackKey", "NDC");
    Map<String, String> yaml = Map.of("cache.maxEntries", "50", "trace.maxParamBytes", "64");
    Map<String, String> overrides = Map.of("cache.maxEntries", "10");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged =
        ConfigMerger.buildEffectiveConfig(Optional.of(yaml), overrides, defaults, warnings::add);

    assertEquals("10", merged.get("cache.maxEntries"));
    assertEquals("64", merged.get("trace.maxParamBytes"));
    assertEquals("NDC", merged.get("context.stackKey"));
    assertEquals(List.of("System property overrides YAML for key: cache.maxEntries"), warnings);
  }

  @Test
  void overrideWithoutYamlKeyDoesNotWarn() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.empty(), Map.of("context.stackKey", "TRAIL"), Map.of("context.stackKey", "NDC"), warnings::add);

    assertEquals("TRAIL", merged.get("context.stackKey"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void propertiesAreFilteredByPrefix() {
    Properties properties = new Properties();
    properties.setProperty("logkit.cache.maxEntries", "5");
    properties.setProperty("logkit.config", "/tmp/ignored.yaml");
    properties.setProperty("user.home", "/home/x");

    Map<String, String> settings = ConfigMerger.fromProperties(properties);

    assertEquals(Map.of("cache.maxEntries", "5"), settings);
    assertFalse(settings.containsKey("config"));
    assertTrue(ConfigMerger.fromProperties(null).isEmpty());
  }
}
