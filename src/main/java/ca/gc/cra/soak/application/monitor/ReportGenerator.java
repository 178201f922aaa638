package ca.gc.cra.soak.application.monitor;

import ca.gc.cra.soak.config.SessionConfig;
import ca.gc.cra.soak.domain.analysis.Alert;
import ca.gc.cra.soak.domain.analysis.AlertType;
import ca.gc.cra.soak.domain.analysis.HealthCheck;
import ca.gc.cra.soak.domain.analysis.HealthStatus;
import ca.gc.cra.soak.domain.analysis.LeakCandidate;
import ca.gc.cra.soak.domain.analysis.LeakType;
import ca.gc.cra.soak.domain.analysis.RemediationRecord;
import ca.gc.cra.soak.domain.analysis.Severity;
import ca.gc.cra.soak.domain.analysis.TrendAnalysis;
import ca.gc.cra.soak.domain.metrics.MemorySample;
import ca.gc.cra.soak.domain.metrics.PerformanceSample;
import ca.gc.cra.soak.domain.metrics.Snapshot;
import ca.gc.cra.soak.domain.report.FinalReport;
import ca.gc.cra.soak.domain.report.FinalReport.AlertSummary;
import ca.gc.cra.soak.domain.report.FinalReport.HealthSummary;
import ca.gc.cra.soak.domain.report.FinalReport.LeakSummary;
import ca.gc.cra.soak.domain.report.FinalReport.MemoryAnalysis;
import ca.gc.cra.soak.domain.report.FinalReport.OperationSummary;
import ca.gc.cra.soak.domain.report.FinalReport.PerformanceAnalysis;
import ca.gc.cra.soak.domain.report.FinalReport.RemediationSummary;
import ca.gc.cra.soak.domain.report.FinalReport.SessionSummary;
import ca.gc.cra.soak.domain.report.Grade;
import ca.gc.cra.soak.domain.report.GradeLetter;
import ca.gc.cra.soak.domain.report.Recommendation;
import ca.gc.cra.soak.domain.report.RecommendationCategory;
import ca.gc.cra.soak.domain.report.ScoreTrend;
import ca.gc.cra.soak.domain.session.OperationEvent;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> Produces the {@link FinalReport} of a finalized session.
 * <p><strong>Grade:</strong> memory stability 30 points (all or nothing), performance 25 points reduced
 * proportionally below the target frame rate, average health 25 points scaled by score, alerts 20 points
 * minus 10 per CRITICAL and 5 per HIGH alert. The sum is clamped to {@code [0, 100]} and mapped to a letter
 * via {@link GradeLetter}.</p>
 * <p><strong>Data quality:</strong> the report is flagged incomplete when snapshots or health checks fall
 * below {@code incompleteDataRatio} of the count expected for the elapsed time and cadence.</p>
 * <p><strong>Thread-safety:</strong> Stateless and pure; safe for concurrent use.</p>
 *
 * @since SOAK 0.1
 */
public final class ReportGenerator {
  private static final double MILLIS_PER_HOUR = 3_600_000d;
  private static final double MEMORY_WEIGHT = 30d;
  private static final double PERFORMANCE_WEIGHT = 25d;
  private static final double HEALTH_WEIGHT = 25d;
  private static final double ALERT_WEIGHT = 20d;
  private static final double CRITICAL_ALERT_POINTS = 10d;
  private static final double HIGH_ALERT_POINTS = 5d;
  private static final double HEALTH_RECOMMENDATION_THRESHOLD = 80d;

  /**
   * Generates the report.
   *
   * @param data frozen session data copy
   * @return final report
   */
  public FinalReport generate(SessionDataView data) {
    Objects.requireNonNull(data, "data");
    SessionConfig config = data.config();
    LeakAnalysisEngine engine = new LeakAnalysisEngine(config.leak(), config.component());

    SessionSummary session = new SessionSummary(
        data.sessionId(),
        data.startedAtMillis(),
        data.endedAtMillis(),
        config.sessionDuration().toMillis(),
        data.snapshots().size(),
        data.healthChecks().size(),
        data.alerts().size(),
        data.leakCandidates().size(),
        data.operations().size());
    MemoryAnalysis memory = analyzeMemory(data.snapshots(), config, engine);
    PerformanceAnalysis performance = analyzePerformance(data.snapshots());
    LeakSummary leaks = summarizeLeaks(data.leakCandidates());
    AlertSummary alerts = summarizeAlerts(data.alerts());
    HealthSummary health = summarizeHealth(data.healthChecks());
    OperationSummary operations = summarizeOperations(data.operations(), data.elapsedMillis());
    RemediationSummary remediation = summarizeRemediation(data.remediations());

    List<String> dataQualityNotes = assessDataQuality(data);
    Grade grade = grade(memory, performance, health, alerts, config);
    List<Recommendation> recommendations = recommend(
        memory, performance, health, leaks, alerts, !dataQualityNotes.isEmpty(), config);

    return new FinalReport(
        session,
        memory,
        performance,
        leaks,
        alerts,
        health,
        operations,
        remediation,
        recommendations,
        grade,
        !dataQualityNotes.isEmpty(),
        dataQualityNotes);
  }

  /**
   * Computes the weighted grade.
   *
   * @param memory memory analysis
   * @param performance performance analysis
   * @param health health summary
   * @param alerts alert summary
   * @param config session configuration supplying the frame-rate target
   * @return grade with sub-scores
   */
  Grade grade(
      MemoryAnalysis memory,
      PerformanceAnalysis performance,
      HealthSummary health,
      AlertSummary alerts,
      SessionConfig config) {
    double memoryScore = memory.memoryStable() ? MEMORY_WEIGHT : 0d;

    double target = config.performance().minFrameRate();
    double performanceScore = PERFORMANCE_WEIGHT;
    if (performance.averageFrameRate().isPresent() && performance.averageFrameRate().getAsDouble() < target) {
      double deficit = (target - performance.averageFrameRate().getAsDouble()) / target;
      performanceScore = Math.max(0d, PERFORMANCE_WEIGHT - PERFORMANCE_WEIGHT * deficit);
    }

    double healthScore = health.averageScore().isPresent()
        ? HEALTH_WEIGHT * health.averageScore().getAsDouble() / 100d
        : HEALTH_WEIGHT;

    double alertScore = Math.max(0d, ALERT_WEIGHT
        - CRITICAL_ALERT_POINTS * alerts.count(Severity.CRITICAL)
        - HIGH_ALERT_POINTS * alerts.count(Severity.HIGH));

    double total = Math.max(0d, Math.min(100d, memoryScore + performanceScore + healthScore + alertScore));
    double rounded = round1(total);
    return new Grade(
        rounded,
        GradeLetter.fromScore(rounded),
        round1(memoryScore),
        round1(performanceScore),
        round1(healthScore),
        round1(alertScore));
  }

  private MemoryAnalysis analyzeMemory(
      List<Snapshot> snapshots, SessionConfig config, LeakAnalysisEngine engine) {
    if (snapshots.isEmpty()) {
      return new MemoryAnalysis(0d, 0d, 0d, 0d, 0d, 0d, true, TrendAnalysis.insufficient(0));
    }
    Snapshot first = snapshots.get(0);
    Snapshot last = snapshots.get(snapshots.size() - 1);
    double peak = Double.NEGATIVE_INFINITY;
    double sum = 0d;
    for (Snapshot snapshot : snapshots) {
      peak = Math.max(peak, snapshot.usedMb());
      sum += snapshot.usedMb();
    }
    double growthMb = (last.memory().usedBytes() - first.memory().usedBytes()) / MemorySample.BYTES_PER_MB;
    double hours = (last.timestampMillis() - first.timestampMillis()) / MILLIS_PER_HOUR;
    double growthRate = hours > 0d ? growthMb / hours : 0d;

    TrendAnalysis trend;
    try {
      trend = engine.analyzeTrend(snapshots);
    } catch (AnalysisException ex) {
      trend = TrendAnalysis.insufficient(snapshots.size());
    }
    return new MemoryAnalysis(
        first.usedMb(),
        last.usedMb(),
        peak,
        sum / snapshots.size(),
        growthMb,
        growthRate,
        growthMb <= config.leak().maxMemoryGrowthMb(),
        trend);
  }

  private PerformanceAnalysis analyzePerformance(List<Snapshot> snapshots) {
    List<PerformanceSample> samples = new ArrayList<>();
    for (Snapshot snapshot : snapshots) {
      snapshot.performance().ifPresent(samples::add);
    }
    if (samples.isEmpty()) {
      return new PerformanceAnalysis(
          OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty(), 0);
    }
    return new PerformanceAnalysis(
        samples.stream().mapToDouble(PerformanceSample::frameRate).average(),
        samples.stream().mapToDouble(PerformanceSample::frameRate).min(),
        samples.stream().mapToDouble(PerformanceSample::frameRate).max(),
        samples.stream().mapToDouble(PerformanceSample::responseTimeMillis).average(),
        samples.size());
  }

  private LeakSummary summarizeLeaks(List<LeakCandidate> candidates) {
    Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
    Map<LeakType, Integer> byType = new EnumMap<>(LeakType.class);
    for (LeakCandidate candidate : candidates) {
      bySeverity.merge(candidate.severity(), 1, Integer::sum);
      byType.merge(candidate.type(), 1, Integer::sum);
    }
    return new LeakSummary(candidates.size(), bySeverity, byType);
  }

  private AlertSummary summarizeAlerts(List<Alert> alerts) {
    Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
    Map<AlertType, Integer> byType = new EnumMap<>(AlertType.class);
    for (Alert alert : alerts) {
      bySeverity.merge(alert.severity(), 1, Integer::sum);
      byType.merge(alert.type(), 1, Integer::sum);
    }
    return new AlertSummary(alerts.size(), bySeverity, byType);
  }

  private HealthSummary summarizeHealth(List<HealthCheck> checks) {
    List<Double> scores = checks.stream().map(HealthCheck::score).toList();
    int consecutiveFailures = 0;
    for (int i = checks.size() - 1; i >= 0 && failing(checks.get(i)); i--) {
      consecutiveFailures++;
    }
    return new HealthSummary(
        checks.stream().mapToDouble(HealthCheck::score).average(),
        checks.stream().mapToDouble(HealthCheck::score).min(),
        checks.size(),
        scores.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(scores.get(scores.size() - 1)),
        ScoreTrend.of(scores),
        consecutiveFailures);
  }

  private static boolean failing(HealthCheck check) {
    return check.status() == HealthStatus.CRITICAL || check.status() == HealthStatus.FAILING;
  }

  private OperationSummary summarizeOperations(List<OperationEvent> operations, long elapsedMillis) {
    Map<String, Integer> byType = new LinkedHashMap<>();
    for (OperationEvent operation : operations) {
      byType.merge(operation.type(), 1, Integer::sum);
    }
    double hours = elapsedMillis / MILLIS_PER_HOUR;
    double perHour = hours > 0d ? operations.size() / hours : 0d;
    return new OperationSummary(operations.size(), byType, round1(perHour));
  }

  private RemediationSummary summarizeRemediation(List<RemediationRecord> records) {
    int successes = 0;
    long reclaimed = 0L;
    for (RemediationRecord record : records) {
      if (record.outcome().success()) {
        successes++;
      }
      reclaimed += Math.max(0L, record.outcome().reclaimedBytes());
    }
    return new RemediationSummary(records.size(), successes, round1(reclaimed / MemorySample.BYTES_PER_MB));
  }

  private List<String> assessDataQuality(SessionDataView data) {
    SessionConfig config = data.config();
    long elapsed = data.elapsedMillis();
    double ratio = config.incompleteDataRatio();
    List<String> notes = new ArrayList<>();

    long expectedSnapshots = elapsed / config.snapshotInterval().toMillis() + 1;
    if (data.snapshots().size() < ratio * expectedSnapshots) {
      notes.add("Observed " + data.snapshots().size() + " snapshots; expected about " + expectedSnapshots
          + " for " + elapsed + "ms at " + config.snapshotInterval());
    }
    long expectedChecks = elapsed / config.healthCheckInterval().toMillis();
    if (expectedChecks >= 1 && data.healthChecks().size() < ratio * expectedChecks) {
      notes.add("Observed " + data.healthChecks().size() + " health checks; expected about "
          + expectedChecks + " for " + elapsed + "ms at " + config.healthCheckInterval());
    }
    return notes;
  }

  private List<Recommendation> recommend(
      MemoryAnalysis memory,
      PerformanceAnalysis performance,
      HealthSummary health,
      LeakSummary leaks,
      AlertSummary alerts,
      boolean incompleteData,
      SessionConfig config) {
    Map<RecommendationCategory, Recommendation> byCategory = new EnumMap<>(RecommendationCategory.class);

    if (leaks.total() > 0) {
      add(byCategory, new Recommendation(RecommendationCategory.MEMORY_LEAKS, Severity.CRITICAL,
          leaks.total() + " potential memory leak(s) detected; fix them before production use"));
    }
    if (!memory.memoryStable()) {
      add(byCategory, new Recommendation(RecommendationCategory.MEMORY, Severity.HIGH,
          String.format(Locale.ROOT,
              "Memory grew %.1fMB (limit %.1fMB, %.1fMB/hour); review caches, listeners and retained references",
              memory.growthMb(), config.leak().maxMemoryGrowthMb(), memory.growthRateMbPerHour())));
    }
    if (alerts.count(Severity.CRITICAL) > 0) {
      add(byCategory, new Recommendation(RecommendationCategory.ALERTS, Severity.HIGH,
          alerts.count(Severity.CRITICAL) + " critical alert(s) raised; investigate each before the next run"));
    }
    double target = config.performance().minFrameRate();
    boolean lowFrameRate = performance.averageFrameRate().isPresent()
        && performance.averageFrameRate().getAsDouble() < target;
    boolean slowResponse = performance.averageResponseTimeMillis().isPresent()
        && performance.averageResponseTimeMillis().getAsDouble() > config.performance().maxResponseTimeMillis();
    if (lowFrameRate || slowResponse) {
      boolean severe = lowFrameRate && performance.averageFrameRate().getAsDouble() < 30d;
      add(byCategory, new Recommendation(RecommendationCategory.PERFORMANCE,
          severe ? Severity.HIGH : Severity.MEDIUM,
          "Performance fell below target; optimize rendering and reduce work per interaction"));
    }
    if (health.averageScore().isPresent()
        && health.averageScore().getAsDouble() < HEALTH_RECOMMENDATION_THRESHOLD) {
      add(byCategory, new Recommendation(RecommendationCategory.HEALTH, Severity.MEDIUM,
          String.format(Locale.ROOT, "Average health score was %.1f; address the recurring health issues",
              health.averageScore().getAsDouble())));
    }
    if (incompleteData) {
      add(byCategory, new Recommendation(RecommendationCategory.DATA_QUALITY, Severity.LOW,
          "Monitoring data is incomplete; rerun with a stable metrics provider before trusting the grade"));
    }

    List<Recommendation> ordered = new ArrayList<>(byCategory.values());
    ordered.sort(Comparator.comparing(Recommendation::priority).reversed()
        .thenComparing(Recommendation::category));
    return List.copyOf(ordered);
  }

  private static void add(Map<RecommendationCategory, Recommendation> target, Recommendation recommendation) {
    target.merge(recommendation.category(), recommendation,
        (existing, candidate) -> candidate.priority().compareTo(existing.priority()) > 0 ? candidate : existing);
  }

  private static double round1(double value) {
    return Math.round(value * 10d) / 10d;
  }
}
