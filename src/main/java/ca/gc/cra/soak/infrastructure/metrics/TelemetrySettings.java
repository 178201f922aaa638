package ca.gc.cra.soak.infrastructure.metrics;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolved exporter settings for the monitor's own metrics.
 * <p><strong>Sources:</strong> the standard OpenTelemetry system properties and environment variables
 * ({@code otel.metrics.exporter}/{@code OTEL_METRICS_EXPORTER}, {@code otel.exporter.otlp.endpoint}/
 * {@code OTEL_EXPORTER_OTLP_ENDPOINT}, {@code otel.resource.attributes}/{@code OTEL_RESOURCE_ATTRIBUTES},
 * {@code otel.metric.export.interval}/{@code OTEL_METRIC_EXPORT_INTERVAL}), then the session
 * configuration keys {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}
 * through {@link #withOverrides(Map)}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param exporter selected exporter
 * @param endpoint OTLP gRPC endpoint
 * @param exportInterval periodic export cadence
 * @param resourceAttributes extra resource attributes
 * @since SOAK 0.1
 */
public record TelemetrySettings(
    Exporter exporter, String endpoint, Duration exportInterval, Map<String, String> resourceAttributes) {
  private static final Logger log = LoggerFactory.getLogger(TelemetrySettings.class);

  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  public static final Duration DEFAULT_EXPORT_INTERVAL = Duration.ofSeconds(60);

  /** Exporters the monitor can ship metrics to. */
  public enum Exporter {
    OTLP,
    NONE;

    /**
     * Parses an exporter name.
     *
     * @param raw {@code otlp} or {@code none}, case-insensitive
     * @return exporter
     * @throws IllegalArgumentException for any other name
     */
    public static Exporter parse(String raw) {
      String name = Objects.requireNonNull(raw, "raw").trim().toLowerCase(Locale.ROOT);
      return switch (name) {
        case "otlp" -> OTLP;
        case "none" -> NONE;
        default -> throw new IllegalArgumentException(
            "metricsExporter must be 'otlp' or 'none', was '" + raw + "'");
      };
    }
  }

  public TelemetrySettings {
    Objects.requireNonNull(exporter, "exporter");
    endpoint = requireEndpoint(endpoint);
    Objects.requireNonNull(exportInterval, "exportInterval");
    if (exportInterval.isZero() || exportInterval.isNegative()) {
      throw new IllegalArgumentException("exportInterval must be positive");
    }
    resourceAttributes = Map.copyOf(resourceAttributes);
  }

  /**
   * OTLP to the local collector every minute, with no extra attributes.
   *
   * @return default settings
   */
  public static TelemetrySettings defaults() {
    return new TelemetrySettings(Exporter.OTLP, DEFAULT_ENDPOINT, DEFAULT_EXPORT_INTERVAL, Map.of());
  }

  /**
   * Reads system properties, falling back to environment variables, then defaults.
   *
   * @return resolved settings; malformed values are logged and replaced by defaults
   */
  public static TelemetrySettings fromEnvironment() {
    return fromSources(System::getProperty, System::getenv);
  }

  static TelemetrySettings fromSources(UnaryOperator<String> properties, UnaryOperator<String> environment) {
    TelemetrySettings d = defaults();
    Exporter exporter = d.exporter();
    String exporterRaw = lookup(properties, environment, "otel.metrics.exporter", "OTEL_METRICS_EXPORTER");
    if (!exporterRaw.isEmpty()) {
      try {
        exporter = Exporter.parse(exporterRaw);
      } catch (IllegalArgumentException ex) {
        log.warn("Unknown metrics exporter '{}'; using otlp", exporterRaw);
      }
    }
    String endpoint = d.endpoint();
    String endpointRaw =
        lookup(properties, environment, "otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT");
    if (!endpointRaw.isEmpty()) {
      try {
        endpoint = requireEndpoint(endpointRaw);
      } catch (IllegalArgumentException ex) {
        log.warn("Ignoring invalid OTLP endpoint '{}': {}", endpointRaw, ex.getMessage());
      }
    }
    Duration interval = parseInterval(
        lookup(properties, environment, "otel.metric.export.interval", "OTEL_METRIC_EXPORT_INTERVAL"));
    Map<String, String> attributes = parseResourceAttributes(
        lookup(properties, environment, "otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES"));
    return new TelemetrySettings(exporter, endpoint, interval, attributes);
  }

  /**
   * Applies the session configuration keys on top of these settings. Blank values are ignored;
   * configured resource attributes are added to, and win over, the existing ones.
   *
   * @param config effective flat configuration
   * @return updated settings
   * @throws IllegalArgumentException when the exporter or endpoint is invalid
   */
  public TelemetrySettings withOverrides(Map<String, String> config) {
    Objects.requireNonNull(config, "config");
    Exporter nextExporter = exporter;
    String rawExporter = trim(config.get("metricsExporter"));
    if (!rawExporter.isEmpty()) {
      nextExporter = Exporter.parse(rawExporter);
    }
    String rawEndpoint = trim(config.get("otelEndpoint"));
    String nextEndpoint = rawEndpoint.isEmpty() ? endpoint : rawEndpoint;
    Map<String, String> nextAttributes = new LinkedHashMap<>(resourceAttributes);
    nextAttributes.putAll(parseResourceAttributes(config.get("otelResourceAttributes")));
    return new TelemetrySettings(nextExporter, nextEndpoint, exportInterval, nextAttributes);
  }

  public boolean enabled() {
    return exporter != Exporter.NONE;
  }

  /**
   * Parses {@code key=value} pairs separated by commas, skipping malformed entries.
   *
   * @param raw attribute list; {@code null} or blank yields an empty map
   * @return ordered attributes
   */
  static Map<String, String> parseResourceAttributes(String raw) {
    Map<String, String> attributes = new LinkedHashMap<>();
    if (raw == null || raw.isBlank()) {
      return attributes;
    }
    for (String token : raw.split(",")) {
      String pair = token.trim();
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      String key = eq < 0 ? "" : pair.substring(0, eq).trim();
      String value = eq < 0 ? "" : pair.substring(eq + 1).trim();
      if (key.isEmpty() || value.isEmpty()) {
        log.warn("Ignoring malformed resource attribute: {}", pair);
        continue;
      }
      attributes.put(key, value);
    }
    return attributes;
  }

  private static String requireEndpoint(String raw) {
    String value = trim(raw);
    URI uri;
    try {
      uri = new URI(value);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
    return value;
  }

  private static Duration parseInterval(String raw) {
    if (raw.isEmpty()) {
      return DEFAULT_EXPORT_INTERVAL;
    }
    try {
      long millis = Long.parseLong(raw);
      if (millis > 0) {
        return Duration.ofMillis(millis);
      }
    } catch (NumberFormatException ex) {
      log.debug("Unparseable export interval {}", raw, ex);
    }
    log.warn("Ignoring invalid metric export interval '{}'", raw);
    return DEFAULT_EXPORT_INTERVAL;
  }

  private static String lookup(
      UnaryOperator<String> properties, UnaryOperator<String> environment, String property, String env) {
    String value = trim(properties.apply(property));
    return value.isEmpty() ? trim(environment.apply(env)) : value;
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
