package ca.gc.cra.soak.config;

import ca.gc.cra.soak.infrastructure.metrics.TelemetrySettings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Layers session configuration: embedded defaults, then the YAML profile, then explicit overrides.
 *
 * <p>The merged map must build a valid {@link SessionConfig} and valid telemetry settings. Keys that
 * are absent from the defaults are kept but reported through the warning callback.</p>
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration.
   *
   * @param yaml optional YAML-derived settings for the profile
   * @param overrides explicit key/value overrides; {@code null} keys and values are skipped
   * @param defaults embedded defaults; their key set defines the recognised keys
   * @param warn receives one message per shadowed YAML key and per unrecognised key
   * @return immutable merged configuration map
   * @throws ConfigurationException when the merged configuration is invalid
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> overrides,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Consumer<String> sink = warn == null ? message -> {} : warn;
    Map<String, String> base = defaults == null ? Map.of() : defaults;
    Map<String, String> fromYaml = yaml.orElse(Map.of());

    Map<String, String> merged = new LinkedHashMap<>(base);
    fromYaml.forEach((key, value) -> {
      reportUnknown(key, "YAML", base, sink);
      merged.put(key, value);
    });
    if (overrides != null) {
      overrides.forEach((key, value) -> {
        if (key == null || value == null) {
          return;
        }
        reportUnknown(key, "override", base, sink);
        if (fromYaml.containsKey(key)) {
          sink.accept("Override replaces YAML value for key: " + key);
        }
        merged.put(key, value);
      });
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void reportUnknown(
      String key, String source, Map<String, String> known, Consumer<String> sink) {
    if (!known.isEmpty() && !known.containsKey(key)) {
      sink.accept("Unrecognised " + source + " key: " + key);
    }
  }

  private static void validate(Map<String, String> effective) {
    try {
      TelemetrySettings.defaults().withOverrides(effective);
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException(ex.getMessage(), ex);
    }
    SessionConfig.fromMap(effective);
  }
}
