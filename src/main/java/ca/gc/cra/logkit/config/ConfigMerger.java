package ca.gc.cra.logkit.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and system properties while enforcing precedence.
 */
public final class ConfigMerger {
  /** Prefix identifying logkit system properties. */
  public static final String PROPERTY_PREFIX = "logkit.";

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence overrides &gt; YAML &gt; defaults.
   *
   * @param yaml optional YAML-derived settings
   * @param overrides key/value overrides, typically from system properties (may be empty)
   * @param defaults embedded defaults
   * @param warn consumer invoked when an override replaces a YAML key; may be {@code null}
   * @return immutable merged configuration map
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> overrides,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> overridesCopy = overrides == null ? Map.of() : overrides;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : overridesCopy.entrySet()) {
      String key = entry.getKey();
      String value = entry.getValue();
      if (key == null || value == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("System property overrides YAML for key: " + key);
      }
      merged.put(key, value);
    }
    return Map.copyOf(merged);
  }

  /**
   * Extracts {@code logkit.*} entries from system-style properties, stripping the prefix.
   *
   * @param properties property source, typically {@link System#getProperties()}
   * @return settings keyed without the {@code logkit.} prefix; {@link ConfigLoader#CONFIG_PATH_PROPERTY} is excluded
   */
  public static Map<String, String> fromProperties(Properties properties) {
    Map<String, String> settings = new LinkedHashMap<>();
    if (properties == null) {
      return settings;
    }
    for (String name : properties.stringPropertyNames()) {
      if (!name.startsWith(PROPERTY_PREFIX) || name.equals(ConfigLoader.CONFIG_PATH_PROPERTY)) {
        continue;
      }
      settings.put(name.substring(PROPERTY_PREFIX.length()), properties.getProperty(name));
    }
    return settings;
  }
}
