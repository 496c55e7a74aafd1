package ca.gc.cra.logkit.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads logkit configuration from a YAML document and flattens it into simple key/value maps.
 *
 * <p>Settings are read from a top-level {@code logkit} section when present, otherwise from the document root.
 * Nested mappings become dotted keys ({@code cache: {maxEntries: 50}} yields {@code cache.maxEntries=50}).
 */
public final class YamlConfigLoader {
  static final String ROOT_SECTION = "logkit";

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path}.
   *
   * @param path location of the YAML configuration
   * @return flat settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, path.toString()));
    }
  }

  /**
   * Loads YAML from a classpath resource.
   *
   * @param resource resource name such as {@code logkit.yaml}
   * @param loader class loader used for lookup; {@code null} selects this class's loader
   * @return flat settings, or empty when the resource does not exist
   * @throws IOException when the resource cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> loadResource(String resource, ClassLoader loader) throws IOException {
    Objects.requireNonNull(resource, "resource");
    ClassLoader effective = loader == null ? YamlConfigLoader.class.getClassLoader() : loader;
    try (InputStream in = effective.getResourceAsStream(resource)) {
      if (in == null) {
        return Optional.empty();
      }
      try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
        return Optional.of(parse(reader, "classpath:" + resource));
      }
    }
  }

  static Map<String, String> parse(Reader reader, String source) {
    try {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Map.of();
      }
      Map<String, Object> root = asMap(document, "root");
      Object section = findSection(root, ROOT_SECTION);
      Map<String, Object> settings = section == null ? root : asMap(section, ROOT_SECTION);

      Map<String, String> flattened = new LinkedHashMap<>();
      flatten(settings, "", flattened);
      return Map.copyOf(flattened);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + source, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
