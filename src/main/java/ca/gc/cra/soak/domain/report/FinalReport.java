package ca.gc.cra.soak.domain.report;

import ca.gc.cra.soak.domain.analysis.AlertType;
import ca.gc.cra.soak.domain.analysis.LeakType;
import ca.gc.cra.soak.domain.analysis.Severity;
import ca.gc.cra.soak.domain.analysis.TrendAnalysis;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> Immutable outcome of a completed monitoring session.
 * <p><strong>Why:</strong> Gives report exporters and callers a single value describing memory behaviour,
 * performance, leaks, alerts, recommendations and the overall grade.</p>
 * <p><strong>Thread-safety:</strong> Deeply immutable; safe to share across threads.</p>
 *
 * @param session session identity and counts
 * @param memory memory analysis
 * @param performance performance analysis
 * @param leaks leak candidate summary
 * @param alerts alert summary
 * @param health health-check summary
 * @param operations workload operation summary
 * @param remediation remediation summary
 * @param recommendations deduplicated, priority-ordered recommendations
 * @param grade overall grade
 * @param incompleteData {@code true} when observed cadence fell materially short of the expected count
 * @param dataQualityNotes explanation of the incomplete-data flag
 * @since SOAK 0.1
 */
public record FinalReport(
    SessionSummary session,
    MemoryAnalysis memory,
    PerformanceAnalysis performance,
    LeakSummary leaks,
    AlertSummary alerts,
    HealthSummary health,
    OperationSummary operations,
    RemediationSummary remediation,
    List<Recommendation> recommendations,
    Grade grade,
    boolean incompleteData,
    List<String> dataQualityNotes) {

  public FinalReport {
    Objects.requireNonNull(session, "session");
    Objects.requireNonNull(memory, "memory");
    Objects.requireNonNull(performance, "performance");
    Objects.requireNonNull(leaks, "leaks");
    Objects.requireNonNull(alerts, "alerts");
    Objects.requireNonNull(health, "health");
    Objects.requireNonNull(operations, "operations");
    Objects.requireNonNull(remediation, "remediation");
    Objects.requireNonNull(grade, "grade");
    recommendations = List.copyOf(Objects.requireNonNull(recommendations, "recommendations"));
    dataQualityNotes = List.copyOf(Objects.requireNonNull(dataQualityNotes, "dataQualityNotes"));
  }

  /**
   * Session identity and record counts.
   *
   * @param sessionId session identifier
   * @param startedAtMillis start time
   * @param endedAtMillis finalization time
   * @param configuredDurationMillis configured hard cap
   * @param snapshotCount snapshots recorded, baseline included
   * @param healthCheckCount health checks recorded
   * @param alertCount alerts raised
   * @param leakCandidateCount leak candidates detected
   * @param operationCount operation events recorded
   */
  public record SessionSummary(
      String sessionId,
      long startedAtMillis,
      long endedAtMillis,
      long configuredDurationMillis,
      int snapshotCount,
      int healthCheckCount,
      int alertCount,
      int leakCandidateCount,
      int operationCount) {
    public SessionSummary {
      Objects.requireNonNull(sessionId, "sessionId");
    }

    public long actualDurationMillis() {
      return Math.max(0L, endedAtMillis - startedAtMillis);
    }
  }

  /**
   * Used-memory statistics across the snapshot series, in MB.
   *
   * @param initialMb first snapshot
   * @param finalMb last snapshot
   * @param peakMb maximum
   * @param averageMb mean
   * @param growthMb {@code finalMb - initialMb}
   * @param growthRateMbPerHour growth normalised to the elapsed time between first and last snapshot
   * @param memoryStable {@code true} when growth stays within the configured maximum
   * @param trend regression over the most recent snapshots
   */
  public record MemoryAnalysis(
      double initialMb,
      double finalMb,
      double peakMb,
      double averageMb,
      double growthMb,
      double growthRateMbPerHour,
      boolean memoryStable,
      TrendAnalysis trend) {
    public MemoryAnalysis {
      Objects.requireNonNull(trend, "trend");
    }
  }

  /**
   * Frame-rate and response-time statistics; empty values mean the host never reported them.
   *
   * @param averageFrameRate mean frame rate
   * @param minFrameRate minimum frame rate
   * @param maxFrameRate maximum frame rate
   * @param averageResponseTimeMillis mean response time
   * @param sampleCount snapshots carrying a performance sample
   */
  public record PerformanceAnalysis(
      OptionalDouble averageFrameRate,
      OptionalDouble minFrameRate,
      OptionalDouble maxFrameRate,
      OptionalDouble averageResponseTimeMillis,
      int sampleCount) {
    public PerformanceAnalysis {
      Objects.requireNonNull(averageFrameRate, "averageFrameRate");
      Objects.requireNonNull(minFrameRate, "minFrameRate");
      Objects.requireNonNull(maxFrameRate, "maxFrameRate");
      Objects.requireNonNull(averageResponseTimeMillis, "averageResponseTimeMillis");
    }
  }

  /**
   * Leak candidate counts.
   *
   * @param total total candidates
   * @param bySeverity counts per severity
   * @param byType counts per leak type
   */
  public record LeakSummary(int total, Map<Severity, Integer> bySeverity, Map<LeakType, Integer> byType) {
    public LeakSummary {
      bySeverity = Map.copyOf(bySeverity);
      byType = Map.copyOf(byType);
    }

    public int count(Severity severity) {
      return bySeverity.getOrDefault(severity, 0);
    }
  }

  /**
   * Alert counts.
   *
   * @param total total alerts
   * @param bySeverity counts per severity
   * @param byType counts per alert type
   */
  public record AlertSummary(int total, Map<Severity, Integer> bySeverity, Map<AlertType, Integer> byType) {
    public AlertSummary {
      bySeverity = Map.copyOf(bySeverity);
      byType = Map.copyOf(byType);
    }

    public int count(Severity severity) {
      return bySeverity.getOrDefault(severity, 0);
    }
  }

  /**
   * Health-check statistics.
   *
   * @param averageScore mean score; empty without checks
   * @param minScore lowest score; empty without checks
   * @param checkCount number of checks
   * @param latestScore score of the last check; empty without checks
   * @param scoreTrend direction over the last three checks
   * @param consecutiveFailures trailing run of checks in the {@code CRITICAL} or {@code FAILING} band
   */
  public record HealthSummary(
      OptionalDouble averageScore,
      OptionalDouble minScore,
      int checkCount,
      OptionalDouble latestScore,
      ScoreTrend scoreTrend,
      int consecutiveFailures) {
    public HealthSummary {
      Objects.requireNonNull(averageScore, "averageScore");
      Objects.requireNonNull(minScore, "minScore");
      Objects.requireNonNull(latestScore, "latestScore");
      Objects.requireNonNull(scoreTrend, "scoreTrend");
    }
  }

  /**
   * Workload operation statistics.
   *
   * @param total operations recorded
   * @param byType counts per operation type
   * @param operationsPerHour throughput over the actual session duration
   */
  public record OperationSummary(int total, Map<String, Integer> byType, double operationsPerHour) {
    public OperationSummary {
      byType = Map.copyOf(byType);
    }
  }

  /**
   * Remediation statistics.
   *
   * @param attempts hook invocations
   * @param successes successful invocations
   * @param reclaimedMb memory reported as reclaimed
   */
  public record RemediationSummary(int attempts, int successes, double reclaimedMb) {}
}
