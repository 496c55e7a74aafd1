package ca.gc.cra.logkit.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves the effective {@link LogkitConfig} for the running JVM.
 * <p><strong>Why:</strong> Services tune the facade through a YAML file or system properties without code changes.</p>
 * <p><strong>Role:</strong> Configuration helper used by {@link CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read YAML from the path named by {@value #CONFIG_PATH_PROPERTY}, else from classpath {@value #DEFAULT_RESOURCE}.</li>
 *   <li>Overlay {@code logkit.*} system properties on top of YAML and defaults.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 * <p><strong>Observability:</strong> Logs the configuration source at DEBUG and precedence overrides at WARN.</p>
 *
 * @since 0.1.0
 */
public final class ConfigLoader {
  /** System property naming an explicit YAML configuration file. */
  public static final String CONFIG_PATH_PROPERTY = "logkit.config";
  /** Classpath resource consulted when no explicit file is named. */
  public static final String DEFAULT_RESOURCE = "logkit.yaml";

  private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

  private ConfigLoader() {}

  /**
   * Loads configuration using the current system properties.
   *
   * @return effective configuration
   * @throws UncheckedIOException if a configured file exists but cannot be read
   * @throws IllegalArgumentException if a setting is malformed
   */
  public static LogkitConfig load() {
    return load(System.getProperties(), ConfigLoader.class.getClassLoader());
  }

  /**
   * Loads configuration from the given property source and class loader.
   *
   * @param properties property source; {@code null} behaves as empty
   * @param loader class loader consulted for {@value #DEFAULT_RESOURCE}
   * @return effective configuration
   * @throws UncheckedIOException if a configured file exists but cannot be read
   * @throws IllegalArgumentException if a setting is malformed
   */
  public static LogkitConfig load(Properties properties, ClassLoader loader) {
    Optional<Map<String, String>> yaml = readYaml(properties, loader);
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        yaml,
        ConfigMerger.fromProperties(properties),
        LogkitConfig.defaultsAsMap(),
        log::warn);
    return LogkitConfig.fromMap(effective);
  }

  private static Optional<Map<String, String>> readYaml(Properties properties, ClassLoader loader) {
    String explicit = properties == null ? null : properties.getProperty(CONFIG_PATH_PROPERTY);
    try {
      if (explicit != null && !explicit.isBlank()) {
        Path path = Path.of(explicit.trim());
        Optional<Map<String, String>> settings = YamlConfigLoader.load(path);
        if (settings.isEmpty()) {
          log.warn("logkit configuration file {} not found; using defaults", path);
        } else {
          log.debug("Loaded logkit configuration from {}", path);
        }
        return settings;
      }
      Optional<Map<String, String>> settings = YamlConfigLoader.loadResource(DEFAULT_RESOURCE, loader);
      settings.ifPresent(s -> log.debug("Loaded logkit configuration from classpath:{}", DEFAULT_RESOURCE));
      return settings;
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read logkit configuration", ex);
    }
  }
}
