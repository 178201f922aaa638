package ca.gc.cra.soak.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Supplies the flattened default configuration for a monitoring session.
 *
 * <p>The map is the single source of truth for optional YAML keys and programmatic overrides.</p>
 */
public final class DefaultsForSession {
  private static final Map<String, String> DEFAULTS = buildDefaults();

  private DefaultsForSession() {}

  /**
   * Returns session defaults merged with the telemetry keys shared by every profile.
   *
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap() {
    return DEFAULTS;
  }

  private static Map<String, String> buildDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.putAll(SessionConfig.defaults().toFlatMap());
    return Map.copyOf(map);
  }
}
