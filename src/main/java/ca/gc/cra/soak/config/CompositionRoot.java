package ca.gc.cra.soak.config;

import ca.gc.cra.soak.application.monitor.SessionOrchestrator;
import ca.gc.cra.soak.application.monitor.SessionRegistry;
import ca.gc.cra.soak.application.port.ClockPort;
import ca.gc.cra.soak.application.port.MetricsPort;
import ca.gc.cra.soak.application.port.MetricsProvider;
import ca.gc.cra.soak.application.port.ReportExporter;
import ca.gc.cra.soak.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.soak.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.soak.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.soak.infrastructure.remediation.SystemGcRemediationHook;
import ca.gc.cra.soak.infrastructure.runtime.JvmMetricsProvider;
import ca.gc.cra.soak.infrastructure.scheduling.ExecutorTaskScheduler;
import ca.gc.cra.soak.logging.LoggingConfigurator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires a ready {@link SessionOrchestrator} to the JVM adapters.
 * <p><strong>Why:</strong> Embedding applications get a working monitor from configuration alone, while tests
 * build orchestrators with fakes through {@link SessionOrchestrator#builder()}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} over the
 *   OpenTelemetry environment settings for the metrics adapter.</li>
 *   <li>Raise the monitor loggers to DEBUG when {@code verbose=true}.</li>
 *   <li>Create the scheduler and probe threads and the GC remediation hook when automatic remediation is
 *   enabled.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and use on a single thread during startup.</p>
 *
 * @since SOAK 0.1
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final int PROBE_THREADS = 2;

  private final SessionConfig config;
  private final SessionRegistry registry;
  private final Supplier<MetricsPort> metricsFactory;
  private final Supplier<MetricsProvider> providerFactory;
  private MetricsPort metrics;
  private ExecutorService probePool;

  /**
   * Creates a composition root from a loaded configuration, including its telemetry settings.
   *
   * @param loaded configuration produced by {@link SessionConfigLoader}
   * @return composition root using OpenTelemetry metrics and the JVM metrics provider
   * @throws ConfigurationException when a telemetry setting is invalid
   */
  public static CompositionRoot fromLoaded(SessionConfigLoader.LoadedConfig loaded) {
    Objects.requireNonNull(loaded, "loaded");
    TelemetrySettings telemetry = telemetrySettings(TelemetrySettings.fromEnvironment(), loaded.effective());
    return new CompositionRoot(loaded.session(), new SessionRegistry(),
        () -> new OpenTelemetryMetricsAdapter(telemetry), JvmMetricsProvider::new);
  }

  /**
   * Creates a composition root whose metrics follow the OpenTelemetry environment settings.
   *
   * @param config session configuration
   */
  public CompositionRoot(SessionConfig config) {
    this(config, new SessionRegistry(), OpenTelemetryMetricsAdapter::new, JvmMetricsProvider::new);
  }

  CompositionRoot(
      SessionConfig config,
      SessionRegistry registry,
      Supplier<MetricsPort> metricsFactory,
      Supplier<MetricsProvider> providerFactory) {
    this.config = Objects.requireNonNull(config, "config").validate();
    this.registry = Objects.requireNonNull(registry, "registry");
    this.metricsFactory = Objects.requireNonNull(metricsFactory, "metricsFactory");
    this.providerFactory = Objects.requireNonNull(providerFactory, "providerFactory");
  }

  /**
   * Builds an orchestrator for the configured session.
   *
   * @param exporters report exporters invoked after a completed stop
   * @return orchestrator ready for {@code start(config())}
   */
  public SessionOrchestrator sessionOrchestrator(ReportExporter... exporters) {
    if (config.verbose() && LoggingConfigurator.enableVerboseLogging()) {
      log.debug("Verbose logging enabled");
    }
    if (probePool == null) {
      probePool = ExecutorFactories.newProbePool(
          PROBE_THREADS, "soak-probe", (t, ex) -> log.error("Uncaught error on {}", t.getName(), ex));
    }
    SessionOrchestrator.Builder builder = SessionOrchestrator.builder()
        .metricsProvider(providerFactory.get())
        .scheduler(new ExecutorTaskScheduler(
            ExecutorFactories.newSessionScheduler(
                "soak-scheduler", (t, ex) -> log.error("Uncaught error on {}", t.getName(), ex)),
            true))
        .clock(ClockPort.SYSTEM)
        .metrics(metrics())
        .registry(registry)
        .probeExecutor(probePool);
    if (config.enableAutomaticRemediation()) {
      builder.remediationHook(new SystemGcRemediationHook());
    }
    for (ReportExporter exporter : List.of(exporters)) {
      builder.exporter(exporter);
    }
    return builder.build();
  }

  public SessionConfig config() {
    return config;
  }

  public SessionRegistry registry() {
    return registry;
  }

  /**
   * Returns the shared metrics adapter, creating it on first use.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    if (metrics == null) {
      metrics = metricsFactory.get();
    }
    return metrics;
  }

  /**
   * Shuts down the probe pool and the metrics adapter.
   */
  @Override
  public void close() {
    if (probePool != null) {
      probePool.shutdownNow();
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }

  static TelemetrySettings telemetrySettings(TelemetrySettings base, Map<String, String> effective) {
    try {
      return base.withOverrides(effective);
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException(ex.getMessage(), ex);
    }
  }
}
