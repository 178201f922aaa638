package ca.gc.cra.soak.application.monitor;

import static ca.gc.cra.soak.application.monitor.Snapshots.HOUR;
import static ca.gc.cra.soak.application.monitor.Snapshots.MINUTE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.soak.config.SessionConfig;
import ca.gc.cra.soak.domain.analysis.Alert;
import ca.gc.cra.soak.domain.analysis.AlertType;
import ca.gc.cra.soak.domain.analysis.HealthCheck;
import ca.gc.cra.soak.domain.analysis.HealthStatus;
import ca.gc.cra.soak.domain.analysis.LeakCandidate;
import ca.gc.cra.soak.domain.analysis.LeakType;
import ca.gc.cra.soak.domain.analysis.RemediationOutcome;
import ca.gc.cra.soak.domain.analysis.RemediationRecord;
import ca.gc.cra.soak.domain.analysis.Severity;
import ca.gc.cra.soak.domain.metrics.Snapshot;
import ca.gc.cra.soak.domain.report.FinalReport;
import ca.gc.cra.soak.domain.report.GradeLetter;
import ca.gc.cra.soak.domain.report.Recommendation;
import ca.gc.cra.soak.domain.report.RecommendationCategory;
import ca.gc.cra.soak.domain.report.ScoreTrend;
import ca.gc.cra.soak.domain.session.OperationEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ReportGeneratorTest {
  private static final long END = 10 * MINUTE;

  private final SessionConfig config = SessionConfig.fromMap(Map.of(
      "sessionDuration", "PT10M",
      "snapshotInterval", "PT1M",
      "healthCheckInterval", "PT5M",
      "performance.minFrameRate", "50"));
  private final ReportGenerator generator = new ReportGenerator();

  @Test
  void gradeFollowsWeightedFormula() {
    List<Snapshot> snapshots = new ArrayList<>();
    for (int i = 0; i <= 10; i++) {
      if (i == 4) {
        snapshots.add(Snapshots.withPerformance(i * MINUTE, 100d + 5d * i, 25d, 50d));
      } else if (i == 8) {
        snapshots.add(Snapshots.withPerformance(i * MINUTE, 100d + 5d * i, 25d, 80d));
      } else {
        snapshots.add(Snapshots.of(i * MINUTE, 100d + 5d * i));
      }
    }
    List<HealthCheck> checks = List.of(check(5 * MINUTE, 80d), check(10 * MINUTE, 90d));
    List<Alert> alerts = List.of(alert(Severity.CRITICAL, 3 * MINUTE), alert(Severity.LOW, 4 * MINUTE));

    FinalReport report = generator.generate(
        view(snapshots, checks, alerts, List.of(), List.of(), List.of()));

    assertTrue(report.memory().memoryStable());
    assertEquals(50d, report.memory().growthMb(), 1e-9);
    assertEquals(300d, report.memory().growthRateMbPerHour(), 1e-6);
    assertEquals(150d, report.memory().peakMb(), 1e-9);
    assertEquals(125d, report.memory().averageMb(), 1e-9);
    assertEquals(25d, report.performance().averageFrameRate().getAsDouble(), 1e-9);
    assertEquals(65d, report.performance().averageResponseTimeMillis().getAsDouble(), 1e-9);
    assertEquals(2, report.performance().sampleCount());
    assertEquals(85d, report.health().averageScore().getAsDouble(), 1e-9);

    assertEquals(30d, report.grade().memoryScore());
    assertEquals(12.5d, report.grade().performanceScore());
    assertEquals(21.3d, report.grade().healthScore());
    assertEquals(10d, report.grade().alertScore());
    assertEquals(73.8d, report.grade().score());
    assertEquals(GradeLetter.C, report.grade().letter());
    assertEquals("Fair - several issues need attention", report.grade().description());
    assertFalse(report.incompleteData());
    assertEquals(List.of(RecommendationCategory.PERFORMANCE, RecommendationCategory.ALERTS),
        report.recommendations().stream().map(Recommendation::category).toList());
  }

  @Test
  void recommendationsAreDeduplicatedAndOrderedByPriority() {
    List<Snapshot> snapshots = new ArrayList<>();
    for (int i = 0; i <= 10; i++) {
      snapshots.add(Snapshots.withPerformance(i * MINUTE, 100d + 20d * i, 25d, 50d));
    }
    List<LeakCandidate> leaks = List.of(
        LeakCandidate.of(LeakType.TREND_GROWTH, Severity.HIGH, 2 * MINUTE, Map.of(), ""),
        LeakCandidate.of(LeakType.TREND_GROWTH, Severity.HIGH, 3 * MINUTE, Map.of(), ""));
    List<Alert> alerts = List.of(alert(Severity.CRITICAL, 2 * MINUTE), alert(Severity.CRITICAL, 3 * MINUTE));

    FinalReport report = generator.generate(view(
        snapshots, List.of(check(5 * MINUTE, 70d), check(10 * MINUTE, 70d)), alerts, leaks,
        List.of(), List.of()));

    List<RecommendationCategory> categories = report.recommendations().stream()
        .map(Recommendation::category)
        .toList();
    assertEquals(List.of(
        RecommendationCategory.MEMORY_LEAKS,
        RecommendationCategory.MEMORY,
        RecommendationCategory.PERFORMANCE,
        RecommendationCategory.ALERTS,
        RecommendationCategory.HEALTH), categories);
    assertEquals(Severity.CRITICAL, report.recommendations().get(0).priority());
    assertFalse(report.memory().memoryStable());
    assertEquals(0d, report.grade().memoryScore());
    assertEquals(0d, report.grade().alertScore());
    assertEquals(2, report.leaks().count(Severity.HIGH));
    assertEquals(2, report.alerts().count(Severity.CRITICAL));
  }

  @Test
  void missingSnapshotsAndChecksFlagIncompleteData() {
    List<Snapshot> snapshots = List.of(
        Snapshots.of(0L, 100d), Snapshots.of(MINUTE, 100d), Snapshots.of(9 * MINUTE, 100d));

    FinalReport report = generator.generate(view(
        snapshots, List.of(), List.of(), List.of(), List.of(), List.of()));

    assertTrue(report.incompleteData());
    assertEquals(2, report.dataQualityNotes().size());
    Recommendation last = report.recommendations().get(report.recommendations().size() - 1);
    assertEquals(RecommendationCategory.DATA_QUALITY, last.category());
    assertEquals(Severity.LOW, last.priority());
  }

  @Test
  void healthSummaryReportsLatestScoreTrendAndFailureRun() {
    List<Snapshot> snapshots = new ArrayList<>();
    for (int i = 0; i <= 10; i++) {
      snapshots.add(Snapshots.of(i * MINUTE, 100d));
    }
    List<HealthCheck> checks = List.of(
        check(2 * MINUTE, 35d), check(4 * MINUTE, 92d), check(6 * MINUTE, 55d),
        check(8 * MINUTE, 50d), check(10 * MINUTE, 30d));

    FinalReport.HealthSummary health = generator.generate(
        view(snapshots, checks, List.of(), List.of(), List.of(), List.of())).health();

    assertEquals(5, health.checkCount());
    assertEquals(30d, health.latestScore().getAsDouble(), 1e-9);
    assertEquals(30d, health.minScore().getAsDouble(), 1e-9);
    assertEquals(ScoreTrend.DECLINING, health.scoreTrend());
    assertEquals(3, health.consecutiveFailures());
  }

  @Test
  void scoreTrendNeedsThreeChecksAndMoreThanFivePoints() {
    assertEquals(ScoreTrend.INSUFFICIENT_DATA, ScoreTrend.of(List.of(40d, 90d)));
    assertEquals(ScoreTrend.STABLE, ScoreTrend.of(List.of(10d, 80d, 99d, 85d)));
    assertEquals(ScoreTrend.IMPROVING, ScoreTrend.of(List.of(70d, 60d, 75.5d)));
    assertEquals(ScoreTrend.DECLINING, ScoreTrend.of(List.of(80d, 90d, 74d)));
  }

  @Test
  void shortSessionExpectsNoHealthChecks() {
    SessionDataView data = new SessionDataView("s-2", 0L, 2 * MINUTE, config,
        List.of(Snapshots.of(0L, 100d), Snapshots.of(MINUTE, 100d), Snapshots.of(2 * MINUTE, 100d)),
        List.of(), List.of(), List.of(), List.of(), List.of(), true);

    FinalReport report = generator.generate(data);

    assertFalse(report.incompleteData());
    assertEquals(100d, report.grade().score());
    assertEquals(GradeLetter.A, report.grade().letter());
    assertTrue(report.recommendations().isEmpty());
    assertTrue(report.health().averageScore().isEmpty());
    assertTrue(report.health().latestScore().isEmpty());
    assertEquals(ScoreTrend.INSUFFICIENT_DATA, report.health().scoreTrend());
    assertEquals(0, report.health().consecutiveFailures());
    assertTrue(report.performance().averageFrameRate().isEmpty());
  }

  @Test
  void operationsAndRemediationAreSummarized() {
    List<OperationEvent> operations = List.of(
        new OperationEvent(MINUTE, "open", Map.of()),
        new OperationEvent(2 * MINUTE, "close", Map.of()),
        new OperationEvent(3 * MINUTE, "open", Map.of("id", "7")));
    List<RemediationRecord> remediations = List.of(
        new RemediationRecord("a-1", MINUTE, new RemediationOutcome(true, 2L * 1024 * 1024, "ok")),
        new RemediationRecord("a-2", 2 * MINUTE, RemediationOutcome.failed("nope")));
    List<Snapshot> snapshots = new ArrayList<>();
    for (int i = 0; i <= 10; i++) {
      snapshots.add(Snapshots.of(i * MINUTE, 100d));
    }

    FinalReport report = generator.generate(view(
        snapshots, List.of(check(5 * MINUTE, 100d), check(END, 100d)), List.of(), List.of(),
        operations, remediations));

    assertEquals(3, report.operations().total());
    assertEquals(Map.of("open", 2, "close", 1), report.operations().byType());
    assertEquals(18d, report.operations().operationsPerHour());
    assertEquals(2, report.remediation().attempts());
    assertEquals(1, report.remediation().successes());
    assertEquals(2d, report.remediation().reclaimedMb());
    assertEquals(END, report.session().actualDurationMillis());
    assertEquals(11, report.session().snapshotCount());
  }

  @Test
  void trendIsReportedForTheSession() {
    List<Snapshot> snapshots = new ArrayList<>();
    for (int i = 0; i <= 10; i++) {
      snapshots.add(Snapshots.of(i * 6 * MINUTE, 100d + i));
    }
    SessionDataView data = new SessionDataView("s-3", 0L, HOUR, config, snapshots,
        List.of(), List.of(), List.of(), List.of(), List.of(), true);

    FinalReport report = generator.generate(data);

    assertTrue(report.memory().trend().sufficient());
    assertEquals(10d, report.memory().trend().slopeMbPerHour(), 1e-6);
  }

  private SessionDataView view(
      List<Snapshot> snapshots,
      List<HealthCheck> checks,
      List<Alert> alerts,
      List<LeakCandidate> leaks,
      List<OperationEvent> operations,
      List<RemediationRecord> remediations) {
    return new SessionDataView(
        "s-1", 0L, END, config, snapshots, checks, alerts, leaks, operations, remediations, true);
  }

  private static HealthCheck check(long timestampMillis, double score) {
    return new HealthCheck(timestampMillis, score, HealthStatus.fromScore(score), List.of());
  }

  private static Alert alert(Severity severity, long timestampMillis) {
    return new Alert("a-" + timestampMillis, AlertType.MEMORY_LEAK, severity, timestampMillis, "",
        List.of(), Map.of());
  }
}
