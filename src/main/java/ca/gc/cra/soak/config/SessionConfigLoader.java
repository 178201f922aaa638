package ca.gc.cra.soak.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves a {@link SessionConfig} from an optional YAML file, a profile name and
 * programmatic overrides.
 * <p><strong>Role:</strong> Configuration entry point used by embedding applications before they ask
 * {@link CompositionRoot} for an orchestrator.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since SOAK 0.1
 */
public final class SessionConfigLoader {
  /** Profile document shipped with the monitor. */
  public static final String BUNDLED_RESOURCE = "soak.yaml";

  private static final Logger log = LoggerFactory.getLogger(SessionConfigLoader.class);

  private SessionConfigLoader() {}

  /**
   * Loads the effective configuration.
   *
   * @param yamlPath YAML file; {@code null} or missing files fall back to defaults
   * @param profile profile section to merge over {@code common}
   * @param overrides explicit overrides with the highest precedence
   * @return effective configuration and the merged flat map it was built from
   * @throws IOException when the YAML file exists but cannot be read
   * @throws ConfigurationException when the merged configuration is invalid
   */
  public static LoadedConfig load(Path yamlPath, String profile, Map<String, String> overrides)
      throws IOException {
    Optional<Map<String, String>> yaml =
        yamlPath == null ? Optional.empty() : YamlConfigLoader.load(yamlPath, profile);
    if (yamlPath != null && yaml.isEmpty()) {
      log.info("Configuration file {} not found; using defaults", yamlPath);
    }
    return merge(yaml, overrides);
  }

  /**
   * Loads a profile from the {@value #BUNDLED_RESOURCE} document on the classpath.
   *
   * @param profile profile section to merge over {@code common}
   * @param overrides explicit overrides with the highest precedence
   * @return effective configuration and the merged flat map it was built from
   * @throws IOException when the bundled document cannot be read
   * @throws ConfigurationException when the merged configuration is invalid
   */
  public static LoadedConfig loadBundled(String profile, Map<String, String> overrides)
      throws IOException {
    Optional<Map<String, String>> yaml = YamlConfigLoader.loadResource(BUNDLED_RESOURCE, profile);
    if (yaml.isEmpty()) {
      log.warn("Bundled {} missing from classpath; using defaults", BUNDLED_RESOURCE);
    }
    return merge(yaml, overrides);
  }

  private static LoadedConfig merge(Optional<Map<String, String>> yaml, Map<String, String> overrides) {
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        yaml, overrides, DefaultsForSession.asFlatMap(), log::warn);
    return new LoadedConfig(SessionConfig.fromMap(effective), effective);
  }

  /**
   * Result of {@link #load(Path, String, Map)}.
   *
   * @param session typed session configuration
   * @param effective merged flat map, including telemetry keys
   */
  public record LoadedConfig(SessionConfig session, Map<String, String> effective) {
    public LoadedConfig {
      effective = Map.copyOf(effective);
    }
  }
}
