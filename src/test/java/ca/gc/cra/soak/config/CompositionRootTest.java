package ca.gc.cra.soak.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.soak.application.monitor.AlreadyRunningException;
import ca.gc.cra.soak.application.monitor.SessionOrchestrator;
import ca.gc.cra.soak.application.monitor.SessionRegistry;
import ca.gc.cra.soak.application.monitor.StopResult;
import ca.gc.cra.soak.application.port.MetricsPort;
import ca.gc.cra.soak.application.port.MetricsProvider;
import ca.gc.cra.soak.domain.metrics.MemorySample;
import ca.gc.cra.soak.domain.metrics.StructuralCounts;
import ca.gc.cra.soak.domain.report.FinalReport;
import ca.gc.cra.soak.domain.session.SessionStatus;
import ca.gc.cra.soak.infrastructure.metrics.TelemetrySettings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  @Test
  void telemetryKeysOverrideEnvironmentSettings() {
    TelemetrySettings settings = CompositionRoot.telemetrySettings(TelemetrySettings.defaults(), Map.of(
        "metricsExporter", "NONE",
        "otelEndpoint", " https://collector.internal:4317 ",
        "otelResourceAttributes", "deployment.environment=qa"));

    assertEquals(TelemetrySettings.Exporter.NONE, settings.exporter());
    assertFalse(settings.enabled());
    assertEquals("https://collector.internal:4317", settings.endpoint());
    assertEquals(Map.of("deployment.environment", "qa"), settings.resourceAttributes());
  }

  @Test
  void blankTelemetryKeysKeepBaseSettings() {
    TelemetrySettings base = TelemetrySettings.defaults();

    TelemetrySettings settings =
        CompositionRoot.telemetrySettings(base, Map.of("metricsExporter", " ", "otelEndpoint", ""));

    assertEquals(base, settings);
  }

  @Test
  void invalidEndpointsAreRejected() {
    TelemetrySettings base = TelemetrySettings.defaults();
    assertThrows(ConfigurationException.class,
        () -> CompositionRoot.telemetrySettings(base, Map.of("otelEndpoint", "ftp://collector:4317")));
    assertThrows(ConfigurationException.class,
        () -> CompositionRoot.telemetrySettings(base, Map.of("otelEndpoint", "http://")));
    assertThrows(ConfigurationException.class,
        () -> CompositionRoot.telemetrySettings(base, Map.of("otelEndpoint", "http://bad host")));
    assertThrows(ConfigurationException.class,
        () -> CompositionRoot.telemetrySettings(base, Map.of("metricsExporter", "prometheus")));
  }

  @Test
  void invalidConfigurationFailsAtConstruction() {
    SessionConfig invalid = SessionConfig.defaults().withSessionDuration(Duration.ZERO);

    assertThrows(ConfigurationException.class, () -> new CompositionRoot(invalid));
  }

  @Test
  void orchestratorsShareTheRegistryAndMetrics() throws Exception {
    SessionRegistry registry = new SessionRegistry();
    SessionConfig config = SessionConfig.fromMap(Map.of("sessionDuration", "PT1H"));
    List<FinalReport> exported = new ArrayList<>();
    try (CompositionRoot root = new CompositionRoot(config, registry, () -> MetricsPort.NO_OP, FixedProvider::new)) {
      SessionOrchestrator first = root.sessionOrchestrator(exported::add);
      SessionOrchestrator second = root.sessionOrchestrator();
      assertSame(MetricsPort.NO_OP, root.metrics());
      assertSame(registry, root.registry());

      try {
        first.start(root.config());
        assertThrows(AlreadyRunningException.class, () -> second.start(root.config()));

        StopResult result = first.stop();
        assertTrue(result.isCompleted());
        assertEquals(SessionStatus.COMPLETED, first.getStatus().status());
        assertEquals(1, exported.size());
        assertEquals(2, exported.get(0).session().snapshotCount());
      } finally {
        first.close();
        second.close();
      }
    }
  }

  private static final class FixedProvider implements MetricsProvider {
    @Override
    public MemorySample sampleMemory() {
      return MemorySample.ofMegabytes(64d, 128d, 512d);
    }

    @Override
    public StructuralCounts sampleStructuralCounts() {
      return StructuralCounts.of(40L);
    }
  }
}
