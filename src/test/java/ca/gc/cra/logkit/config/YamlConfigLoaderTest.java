package ca.gc.cra.logkit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadFlattensLogkitSection() throws IOException {
    Path yaml = tempDir.resolve("logkit.yaml");
    Files.writeString(yaml, """
        other:
          ignored: true
        logkit:
          cache:
            maxEntries: 12
          context:
            stackKey: TRAIL
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml).orElseThrow();

    assertEquals(Map.of("cache.maxEntries", "12", "context.stackKey", "TRAIL"), map);
  }

  @Test
  void loadReturnsEmptyWhenFileMissing() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("missing.yaml"));

    assertFalse(result.isPresent());
  }

  @Test
  void classpathResourceIsLoaded() throws IOException {
    Map<String, String> map =
        YamlConfigLoader.loadResource("config/logkit-test.yaml", getClass().getClassLoader()).orElseThrow();

    assertEquals("25", map.get("cache.maxEntries"));
    assertEquals("false", map.get("context.stackEnabled"));
    assertTrue(YamlConfigLoader.loadResource("config/absent.yaml", null).isEmpty());
  }

  @Test
  void documentWithoutSectionUsesRoot() throws IOException {
    Map<String, String> map =
        YamlConfigLoader.loadResource("config/logkit-flat.yaml", getClass().getClassLoader()).orElseThrow();

    assertEquals(Map.of("cache.maxEntries", "7", "trace.maxParamBytes", "128"), map);
  }

  @Test
  void emptyDocumentYieldsEmptyMap() {
    assertTrue(YamlConfigLoader.parse(new StringReader(""), "inline").isEmpty());
  }

  @Test
  void sequencesAreRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.parse(new StringReader("logkit:\n  cache:\n    - 1\n    - 2\n"), "inline"));

    assertTrue(ex.getMessage().contains("cache"));
  }

  @Test
  void malformedYamlNamesSource() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.parse(new StringReader("logkit: [unclosed"), "broken.yaml"));

    assertTrue(ex.getMessage().contains("broken.yaml"));
  }

  @Test
  void nonMappingSectionIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.parse(new StringReader("logkit: 5\n"), "inline"));
  }
}
