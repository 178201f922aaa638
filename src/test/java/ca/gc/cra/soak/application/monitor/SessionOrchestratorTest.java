package ca.gc.cra.soak.application.monitor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.soak.application.port.MetricsProvider;
import ca.gc.cra.soak.config.ConfigurationException;
import ca.gc.cra.soak.config.SessionConfig;
import ca.gc.cra.soak.domain.analysis.Alert;
import ca.gc.cra.soak.domain.analysis.AlertType;
import ca.gc.cra.soak.domain.analysis.HealthCheck;
import ca.gc.cra.soak.domain.analysis.LeakCandidate;
import ca.gc.cra.soak.domain.analysis.RemediationOutcome;
import ca.gc.cra.soak.domain.analysis.Severity;
import ca.gc.cra.soak.domain.metrics.MemorySample;
import ca.gc.cra.soak.domain.metrics.StructuralCounts;
import ca.gc.cra.soak.domain.report.FinalReport;
import ca.gc.cra.soak.domain.report.GradeLetter;
import ca.gc.cra.soak.domain.report.Recommendation;
import ca.gc.cra.soak.domain.report.RecommendationCategory;
import ca.gc.cra.soak.domain.session.ProgressReport;
import ca.gc.cra.soak.domain.session.SessionHandle;
import ca.gc.cra.soak.domain.session.SessionStatus;
import ca.gc.cra.soak.domain.session.SessionStatusView;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionOrchestratorTest {
  private static final long START = 1_000_000L;
  private static final long MB = 1024L * 1024L;

  private MutableClock clock;
  private ManualTaskScheduler scheduler;
  private RecordingMetricsPort metrics;
  private SessionRegistry registry;
  private final AtomicInteger ids = new AtomicInteger();

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    scheduler = new ManualTaskScheduler(clock);
    metrics = new RecordingMetricsPort();
    registry = new SessionRegistry();
  }

  @Test
  void growingSessionIsGradedAndReported() throws Exception {
    ScriptedMetricsProvider provider = new ScriptedMetricsProvider(100, 105, 112, 121, 132);
    SessionOrchestrator orchestrator = orchestrator(provider).build();
    List<Alert> alerts = new ArrayList<>();
    List<HealthCheck> checks = new ArrayList<>();
    List<ProgressReport> progress = new ArrayList<>();
    orchestrator.subscribeToAlerts(alerts::add);
    orchestrator.subscribeToHealthChecks(checks::add);
    orchestrator.subscribeToProgress(progress::add);

    SessionHandle handle = orchestrator.start(config());
    assertEquals("s-1", handle.sessionId());
    assertEquals(START + Duration.ofMinutes(4).toMillis(), handle.deadlineMillis());
    assertTrue(orchestrator.getStatus().running());

    scheduler.advance(Duration.ofMinutes(4));

    assertEquals(SessionStatus.COMPLETED, orchestrator.getStatus().status());
    FinalReport report = orchestrator.lastReport().orElseThrow();
    assertEquals(6, report.session().snapshotCount());
    assertEquals(3, report.session().healthCheckCount());
    assertEquals(5, report.session().leakCandidateCount());
    assertEquals(4, report.session().alertCount());
    assertEquals(32d, report.memory().growthMb(), 1e-9);
    assertFalse(report.memory().memoryStable());

    assertEquals(0d, report.grade().memoryScore());
    assertEquals(25d, report.grade().performanceScore());
    assertEquals(15d, report.grade().healthScore());
    assertEquals(0d, report.grade().alertScore());
    assertEquals(40d, report.grade().score());
    assertEquals(GradeLetter.F, report.grade().letter());
    assertFalse(report.incompleteData());
    assertEquals(List.of(
        RecommendationCategory.MEMORY_LEAKS,
        RecommendationCategory.MEMORY,
        RecommendationCategory.HEALTH),
        report.recommendations().stream().map(Recommendation::category).toList());

    assertEquals(4, alerts.size());
    assertTrue(alerts.stream().allMatch(a -> a.severity() == Severity.HIGH));
    assertEquals(AlertType.HEALTH_DEGRADED, alerts.get(3).type());
    assertEquals("s-1-alert-1", alerts.get(0).id());
    assertEquals(List.of(95d, 45d, 40d), checks.stream().map(HealthCheck::score).toList());
    assertEquals(List.of(95L, 45L, 40L), metrics.observed("soak.health.score"));

    assertEquals(2, progress.size());
    assertEquals(50d, progress.get(0).progressPercent(), 1e-9);
    assertEquals(112d, progress.get(0).currentMemoryMb().getAsDouble(), 1e-9);
    assertEquals(100d, progress.get(1).progressPercent(), 1e-9);

    assertEquals(0L, scheduler.activeCount());
    assertTrue(registry.activeSession().isEmpty());
    assertEquals(1, metrics.count("soak.session.started"));
    assertEquals(1, metrics.count("soak.session.completed"));
  }

  @Test
  void stopIsIdempotent() throws Exception {
    SessionOrchestrator orchestrator = orchestrator(new ScriptedMetricsProvider(100)).build();
    assertEquals(StopResult.Outcome.NO_ACTIVE_SESSION, orchestrator.stop().outcome());

    orchestrator.start(config());
    scheduler.advance(Duration.ofMinutes(1));
    StopResult first = orchestrator.stop();
    StopResult second = orchestrator.stop();

    assertTrue(first.isCompleted());
    assertEquals(3, first.report().orElseThrow().session().snapshotCount());
    assertEquals(StopResult.Outcome.NO_ACTIVE_SESSION, second.outcome());
    assertTrue(second.report().isEmpty());
    assertEquals(1, metrics.count("soak.session.completed"));
  }

  @Test
  void secondStartIsRejectedWhileRunning() throws Exception {
    SessionOrchestrator orchestrator = orchestrator(new ScriptedMetricsProvider(100)).build();
    orchestrator.start(config());

    assertThrows(AlreadyRunningException.class, () -> orchestrator.start(config()));
    assertEquals("s-1", orchestrator.getStatus().sessionId());
    assertTrue(orchestrator.getStatus().running());
  }

  @Test
  void sharedRegistryAllowsOneSessionAcrossOrchestrators() throws Exception {
    SessionOrchestrator first = orchestrator(new ScriptedMetricsProvider(100)).build();
    SessionOrchestrator second = orchestrator(new ScriptedMetricsProvider(200)).build();
    first.start(config());

    assertThrows(AlreadyRunningException.class, () -> second.start(config()));
    assertEquals(SessionStatus.IDLE, second.getStatus().status());

    first.stop();
    SessionHandle handle = second.start(config());
    assertEquals(Optional.of(handle.sessionId()), registry.activeSession());
  }

  @Test
  void sessionDataIsFrozenAfterStop() throws Exception {
    SessionOrchestrator orchestrator = orchestrator(new ScriptedMetricsProvider(100)).build();
    orchestrator.start(config());
    orchestrator.recordOperation("open", Map.of("id", "1"));
    orchestrator.stop();

    SessionDataView view = orchestrator.sessionData().orElseThrow();
    assertTrue(view.frozen());
    assertEquals(1, view.operations().size());
    assertThrows(NoActiveSessionException.class, () -> orchestrator.track("grid", 0L));
    assertThrows(NoActiveSessionException.class, () -> orchestrator.recordOperation("open", Map.of()));
    assertThrows(NoActiveSessionException.class, () -> orchestrator.untrack("grid"));

    scheduler.advance(Duration.ofMinutes(10));
    assertEquals(view, orchestrator.sessionData().orElseThrow());
    assertEquals(1, orchestrator.lastReport().orElseThrow().operations().total());
  }

  @Test
  void baselineFailureLeavesErrorStateAndAllowsRestart() throws Exception {
    ScriptedMetricsProvider provider = new ScriptedMetricsProvider(100);
    provider.failNext(1);
    SessionOrchestrator orchestrator = orchestrator(provider).build();

    assertThrows(SnapshotCollectionException.class, () -> orchestrator.start(config()));
    assertEquals(SessionStatus.ERROR, orchestrator.getStatus().status());
    assertEquals(0L, scheduler.activeCount());
    assertTrue(registry.activeSession().isEmpty());

    SessionHandle handle = orchestrator.start(config());
    assertEquals("s-2", handle.sessionId());
    assertEquals(SessionStatus.RUNNING, orchestrator.getStatus().status());
  }

  @Test
  void hungProviderTimesOutWithoutAnExplicitExecutor() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    MetricsProvider hung = new MetricsProvider() {
      @Override
      public MemorySample sampleMemory() throws Exception {
        release.await(5, TimeUnit.SECONDS);
        return MemorySample.ofMegabytes(100, 1_024, 4_096);
      }

      @Override
      public StructuralCounts sampleStructuralCounts() {
        return StructuralCounts.of(500L);
      }
    };
    SessionOrchestrator orchestrator = SessionOrchestrator.builder()
        .metricsProvider(hung)
        .scheduler(scheduler)
        .clock(clock)
        .registry(registry)
        .build();
    try {
      long started = System.nanoTime();
      SessionConfig slowReads = config(Map.of("snapshotTimeout", "PT0.1S"));
      SnapshotCollectionException ex =
          assertThrows(SnapshotCollectionException.class, () -> orchestrator.start(slowReads));

      assertTrue(ex.getMessage().contains("exceeded 100ms"), ex.getMessage());
      assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) < 4_000);
      assertEquals(SessionStatus.ERROR, orchestrator.getStatus().status());
      assertTrue(registry.activeSession().isEmpty());
    } finally {
      release.countDown();
      orchestrator.close();
    }
    assertTrue(scheduler.isClosed());
  }

  @Test
  void invalidConfigurationIsRejectedBeforeAnyStateChange() {
    SessionOrchestrator orchestrator = orchestrator(new ScriptedMetricsProvider(100)).build();
    SessionConfig invalid = SessionConfig.defaults().withSessionDuration(Duration.ZERO);

    assertThrows(ConfigurationException.class, () -> orchestrator.start(invalid));
    assertEquals(SessionStatus.IDLE, orchestrator.getStatus().status());
    assertTrue(registry.activeSession().isEmpty());
  }

  @Test
  void untrackedComponentRetainingMemoryRaisesAlert() throws Exception {
    SessionOrchestrator orchestrator = orchestrator(new ScriptedMetricsProvider(100)).build();
    List<Alert> alerts = new ArrayList<>();
    orchestrator.subscribeToAlerts(alerts::add);
    orchestrator.start(config());

    orchestrator.track("grid", 0L);
    assertEquals(1, orchestrator.getStatus().trackedUnitCount());
    assertTrue(orchestrator.reportUnitSize("grid", 12 * MB));
    assertFalse(orchestrator.reportUnitSize("chart", MB));
    Optional<LeakCandidate> candidate = orchestrator.untrack("grid");

    assertTrue(candidate.isPresent());
    assertEquals(Severity.MEDIUM, candidate.get().severity());
    assertEquals(LeakCandidate.CLEANUP_TAG, candidate.get().tag());
    assertEquals(1, alerts.size());
    assertEquals(AlertType.COMPONENT_LEAK, alerts.get(0).type());
    assertEquals(0, orchestrator.getStatus().trackedUnitCount());
    assertEquals(1, orchestrator.getStatus().leakCandidateCount());
  }

  @Test
  void unitsStillTrackedAtStopAreChecked() throws Exception {
    SessionOrchestrator orchestrator = orchestrator(new ScriptedMetricsProvider(100)).build();
    orchestrator.start(config());
    orchestrator.track("grid", 0L);
    orchestrator.reportUnitSize("grid", 25 * MB);

    FinalReport report = orchestrator.stop().report().orElseThrow();

    assertEquals(1, report.leaks().total());
    assertEquals(1, report.leaks().count(Severity.HIGH));
    assertEquals(1, report.alerts().total());
  }

  @Test
  void failingSubscriberDoesNotStopTheSession() throws Exception {
    SessionOrchestrator orchestrator = orchestrator(new ScriptedMetricsProvider(100)).build();
    List<HealthCheck> received = new ArrayList<>();
    orchestrator.subscribeToHealthChecks(check -> {
      throw new IllegalStateException("subscriber down");
    });
    orchestrator.subscribeToHealthChecks(received::add);
    orchestrator.start(config());

    scheduler.advance(Duration.ofMinutes(2));

    assertEquals(1, received.size());
    assertEquals(SessionStatus.RUNNING, orchestrator.getStatus().status());
    assertEquals(1, metrics.count("soak.subscriber.failed"));
  }

  @Test
  void failedSnapshotIsSkipped() throws Exception {
    ScriptedMetricsProvider provider = new ScriptedMetricsProvider(100, 101);
    SessionOrchestrator orchestrator = orchestrator(provider).build();
    orchestrator.start(config());

    provider.failNext(1);
    scheduler.advance(Duration.ofMinutes(1));
    assertEquals(1, orchestrator.getStatus().snapshotCount());
    assertEquals(SessionStatus.RUNNING, orchestrator.getStatus().status());

    scheduler.advance(Duration.ofMinutes(1));
    assertEquals(2, orchestrator.getStatus().snapshotCount());
    assertEquals(1, metrics.count("soak.snapshot.failed"));
  }

  @Test
  void exporterFailureDoesNotLoseTheReport() throws Exception {
    List<FinalReport> exported = new ArrayList<>();
    SessionOrchestrator orchestrator = orchestrator(new ScriptedMetricsProvider(100))
        .exporter(report -> {
          throw new java.io.IOException("disk full");
        })
        .exporter(exported::add)
        .build();
    orchestrator.start(config());

    StopResult result = orchestrator.stop();

    assertTrue(result.isCompleted());
    assertEquals(1, exported.size());
    assertEquals(result.report().orElseThrow(), exported.get(0));
    assertEquals(SessionStatus.COMPLETED, orchestrator.getStatus().status());
  }

  @Test
  void highAlertsTriggerRemediationWhenEnabled() throws Exception {
    List<Alert> remediated = new ArrayList<>();
    SessionOrchestrator orchestrator = orchestrator(new ScriptedMetricsProvider(100, 105, 112))
        .remediationHook(alert -> {
          remediated.add(alert);
          return new RemediationOutcome(true, 4 * MB, "collected");
        })
        .build();
    orchestrator.start(config(Map.of("enableAutomaticRemediation", "true")));

    scheduler.advance(Duration.ofMinutes(2));
    FinalReport report = orchestrator.stop().report().orElseThrow();

    assertEquals(1, remediated.size());
    assertEquals(1, report.remediation().attempts());
    assertEquals(1, report.remediation().successes());
    assertEquals(4d, report.remediation().reclaimedMb());
  }

  @Test
  void disabledLeakDetectionRecordsNoCandidates() throws Exception {
    SessionOrchestrator orchestrator =
        orchestrator(new ScriptedMetricsProvider(100, 105, 112, 121, 132)).build();
    orchestrator.start(config(Map.of("enableLeakDetection", "false")));

    scheduler.advance(Duration.ofMinutes(4));

    FinalReport report = orchestrator.lastReport().orElseThrow();
    assertEquals(0, report.leaks().total());
    assertEquals(6, report.session().snapshotCount());
    assertFalse(report.memory().memoryStable());
  }

  @Test
  void statusReportsProgressOfTheRunningSession() throws Exception {
    SessionOrchestrator orchestrator = orchestrator(new ScriptedMetricsProvider(100)).build();
    assertEquals(SessionStatusView.idle(), orchestrator.getStatus());

    orchestrator.start(config());
    clock.advance(Duration.ofMinutes(1));
    SessionStatusView status = orchestrator.getStatus();

    assertEquals(Duration.ofMinutes(1).toMillis(), status.elapsedMillis());
    assertEquals(Duration.ofMinutes(3).toMillis(), status.remainingMillis());
    assertEquals(25d, status.progressPercent(), 1e-9);
    assertEquals(1, status.snapshotCount());
  }

  @Test
  void closeStopsTheSessionAndReleasesTheScheduler() throws Exception {
    SessionOrchestrator orchestrator = orchestrator(new ScriptedMetricsProvider(100)).build();
    orchestrator.start(config());

    orchestrator.close();

    assertEquals(SessionStatus.COMPLETED, orchestrator.getStatus().status());
    assertTrue(scheduler.isClosed());
    assertTrue(orchestrator.lastReport().isPresent());
  }

  private SessionOrchestrator.Builder orchestrator(ScriptedMetricsProvider provider) {
    return SessionOrchestrator.builder()
        .metricsProvider(provider)
        .scheduler(scheduler)
        .clock(clock)
        .metrics(metrics)
        .registry(registry)
        .idGenerator(() -> "s-" + ids.incrementAndGet());
  }

  private static SessionConfig config() {
    return config(Map.of());
  }

  private static SessionConfig config(Map<String, String> overrides) {
    Map<String, String> args = new HashMap<>();
    args.put("sessionDuration", "PT4M");
    args.put("snapshotInterval", "PT1M");
    args.put("healthCheckInterval", "PT2M");
    args.put("reportingInterval", "PT2M");
    args.put("componentCheckInterval", "PT30S");
    args.put("leak.maxMemoryGrowthMb", "20");
    args.putAll(overrides);
    return SessionConfig.fromMap(args);
  }
}
