package ca.gc.cra.soak.infrastructure.metrics;

import ca.gc.cra.soak.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MetricsPort} backed by OpenTelemetry.
 *
 * <p>Counters map to {@link LongCounter}s and observations to {@link LongHistogram}s, one instrument
 * per key, created lazily. Instrument names are the lower-cased key; the original key is carried in the
 * {@code soak.metric.key} attribute. Units follow the key suffix: {@code Millis} is {@code ms},
 * {@code Mb} is {@code MBy}, anything else is dimensionless.</p>
 *
 * <p>Thread-safe; instruments are cached in concurrent maps.</p>
 *
 * @since SOAK 0.1
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("soak.metric.key");
  private static final String FALLBACK_NAME = "soak.metric";

  private static final Map<String, String> DESCRIPTIONS = Map.ofEntries(
      Map.entry("soak.session.started", "Monitoring sessions started"),
      Map.entry("soak.session.completed", "Monitoring sessions stopped with a final report"),
      Map.entry("soak.snapshot.taken", "Snapshots appended to session data"),
      Map.entry("soak.snapshot.failed", "Snapshot cycles skipped after a collection failure"),
      Map.entry("soak.snapshot.usedMb", "Used memory at each snapshot"),
      Map.entry("soak.snapshot.readMillis", "Time to read one snapshot from the metrics provider"),
      Map.entry("soak.leak.candidates", "Leak candidates found per snapshot analysis"),
      Map.entry("soak.component.tracked", "Units registered with the lifecycle tracker"),
      Map.entry("soak.component.untracked", "Units removed from the lifecycle tracker"),
      Map.entry("soak.component.candidates", "Component leak candidates raised by the tracker"),
      Map.entry("soak.alert.raised", "Alerts appended to session data"),
      Map.entry("soak.subscriber.failed", "Subscriber callbacks that threw"),
      Map.entry("soak.health.score", "Health check scores"),
      Map.entry("soak.remediation.invoked", "Remediation hook invocations"),
      Map.entry("soak.remediation.failed", "Remediation hook invocations that failed"),
      Map.entry("soak.cycle.failed", "Periodic cycles that failed outside snapshot collection"));

  private final OpenTelemetryBootstrap.MeterHandle handle;
  private final Meter meter;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter configured from OpenTelemetry system properties and environment variables.
   */
  public OpenTelemetryMetricsAdapter() {
    this(TelemetrySettings.fromEnvironment());
  }

  /**
   * Creates an adapter for explicit settings.
   *
   * @param settings exporter settings
   */
  public OpenTelemetryMetricsAdapter(TelemetrySettings settings) {
    this(OpenTelemetryBootstrap.initialize(settings));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.MeterHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.meter = handle.meter();
  }

  @Override
  public void increment(String key) {
    Counter counter = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::newCounter);
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Histogram histogram =
        histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::newHistogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  /**
   * Reports whether signals are discarded.
   *
   * @return {@code true} when the exporter is {@code none} or failed to start
   */
  public boolean isNoop() {
    return handle.isNoop();
  }

  void forceFlush() {
    handle.forceFlush();
  }

  /** Flushes and shuts down the meter provider. */
  @Override
  public void close() {
    handle.close();
  }

  private Counter newCounter(String key) {
    LongCounter counter = meter.counterBuilder(instrumentName(key))
        .setUnit("1")
        .setDescription(describe(key))
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY, key));
  }

  private Histogram newHistogram(String key) {
    LongHistogram histogram = meter.histogramBuilder(instrumentName(key))
        .ofLongs()
        .setUnit(unitFor(key))
        .setDescription(describe(key))
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY, key));
  }

  static String describe(String key) {
    String known = DESCRIPTIONS.get(key);
    if (known != null) {
      return known;
    }
    if (key.startsWith("soak.alert.")) {
      return "Alerts raised at severity " + key.substring("soak.alert.".length());
    }
    return "SOAK metric " + key;
  }

  static String unitFor(String key) {
    if (key.endsWith("Millis")) {
      return "ms";
    }
    return key.endsWith("Mb") ? "MBy" : "1";
  }

  /**
   * Lower-cases {@code key} and replaces characters instrument names may not contain.
   *
   * @param key metric key
   * @return valid instrument name
   */
  static String instrumentName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder name = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      name.append('m');
    }
    for (char c : lower.toCharArray()) {
      boolean allowed = Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
      name.append(allowed ? c : '_');
    }
    if (!name.toString().equals(key)) {
      log.debug("Metric key '{}' exported as '{}'", key, name);
    }
    return name.toString();
  }

  private record Counter(LongCounter instrument, Attributes attributes) {}

  private record Histogram(LongHistogram instrument, Attributes attributes) {}
}
