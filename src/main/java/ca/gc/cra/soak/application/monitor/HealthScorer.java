package ca.gc.cra.soak.application.monitor;

import ca.gc.cra.soak.config.HealthSettings;
import ca.gc.cra.soak.config.LeakThresholds;
import ca.gc.cra.soak.config.PerformanceThresholds;
import ca.gc.cra.soak.config.SessionConfig;
import ca.gc.cra.soak.domain.analysis.Alert;
import ca.gc.cra.soak.domain.analysis.HealthCheck;
import ca.gc.cra.soak.domain.analysis.HealthStatus;
import ca.gc.cra.soak.domain.analysis.Severity;
import ca.gc.cra.soak.domain.metrics.PerformanceSample;
import ca.gc.cra.soak.domain.metrics.Snapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Computes the composite 0-100 health score of a session.
 * <p><strong>Scoring:</strong> starts at 100 and deducts
 * <ul>
 *   <li>a memory-stability penalty of {@code min(40, growth / max * 40)} when growth from the baseline
 *   exceeds {@code maxMemoryGrowthMb};</li>
 *   <li>a frame-rate penalty of up to 30 points, banded below 30, 45 and the target frame rate, with extra
 *   deductions when the minimum frame rate drops below 30 or 45;</li>
 *   <li>a response-time penalty of {@code min(30, (avg / max - 1) * 30)} when the mean response time
 *   exceeds its limit;</li>
 *   <li>a fixed penalty per CRITICAL and HIGH alert raised within the alert window.</li>
 * </ul>
 * The result is clamped to {@code [0, 100]}.</p>
 * <p><strong>Consistency:</strong> a check reflects the data as of its own invocation and may trail the
 * newest snapshot by one cycle.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * @since SOAK 0.1
 */
public final class HealthScorer {
  private static final double MEMORY_PENALTY_CAP = 40d;
  private static final double PERFORMANCE_PENALTY_CAP = 30d;
  private static final double SEVERE_FRAME_RATE = 30d;
  private static final double LOW_FRAME_RATE = 45d;

  private final LeakThresholds leak;
  private final PerformanceThresholds performance;
  private final HealthSettings health;

  /**
   * Creates a scorer from session configuration.
   *
   * @param config session configuration
   */
  public HealthScorer(SessionConfig config) {
    Objects.requireNonNull(config, "config");
    this.leak = config.leak();
    this.performance = config.performance();
    this.health = config.health();
  }

  /**
   * Scores the session as of {@code nowMillis}.
   *
   * @param data session data copy
   * @param nowMillis evaluation time; bounds the alert window
   * @return health check with score, status band and issues
   */
  public HealthCheck computeHealthScore(SessionDataView data, long nowMillis) {
    Objects.requireNonNull(data, "data");
    List<String> issues = new ArrayList<>();
    double score = 100d;

    Snapshot latest = data.latestSnapshot().orElse(null);
    if (latest != null) {
      double growthMb = latest.growthFromBaselineMb();
      if (growthMb > leak.maxMemoryGrowthMb()) {
        score -= Math.min(MEMORY_PENALTY_CAP, growthMb / leak.maxMemoryGrowthMb() * MEMORY_PENALTY_CAP);
        issues.add(String.format(Locale.ROOT,
            "Memory grew %.1fMB from baseline (limit %.1fMB)", growthMb, leak.maxMemoryGrowthMb()));
      }
    }

    List<PerformanceSample> samples = recentPerformance(data.snapshots());
    if (!samples.isEmpty()) {
      double avgFps = samples.stream().mapToDouble(PerformanceSample::frameRate).average().orElse(0d);
      double minFps = samples.stream().mapToDouble(PerformanceSample::frameRate).min().orElse(0d);
      double framePenalty = frameRatePenalty(avgFps, minFps);
      if (framePenalty > 0d) {
        score -= framePenalty;
        issues.add(String.format(Locale.ROOT,
            "Frame rate averaged %.1f FPS (minimum %.1f, target %.1f)",
            avgFps, minFps, performance.minFrameRate()));
      }
      double avgResponse =
          samples.stream().mapToDouble(PerformanceSample::responseTimeMillis).average().orElse(0d);
      if (avgResponse > performance.maxResponseTimeMillis()) {
        score -= Math.min(PERFORMANCE_PENALTY_CAP,
            (avgResponse / performance.maxResponseTimeMillis() - 1d) * PERFORMANCE_PENALTY_CAP);
        issues.add(String.format(Locale.ROOT,
            "Response time averaged %.1fms (limit %.1fms)", avgResponse,
            performance.maxResponseTimeMillis()));
      }
    }

    long windowStart = nowMillis - health.alertWindow().toMillis();
    int critical = 0;
    int high = 0;
    for (Alert alert : data.alerts()) {
      if (alert.timestampMillis() < windowStart || alert.timestampMillis() > nowMillis) {
        continue;
      }
      if (alert.severity() == Severity.CRITICAL) {
        critical++;
      } else if (alert.severity() == Severity.HIGH) {
        high++;
      }
    }
    if (critical + high > 0) {
      score -= critical * health.criticalAlertPenalty() + high * health.highAlertPenalty();
      issues.add(critical + " critical and " + high + " high alerts in the last "
          + health.alertWindow().toMinutes() + " minutes");
    }

    double clamped = Math.max(0d, Math.min(100d, score));
    double rounded = Math.round(clamped * 10d) / 10d;
    return new HealthCheck(nowMillis, rounded, HealthStatus.fromScore(rounded), issues);
  }

  /**
   * Frame-rate penalty in points: band score 0 (&lt;30 FPS), 40 (&lt;45), 70 (&lt;target), 100 otherwise,
   * minus 20/10 when the minimum drops below 30/45, scaled onto the 30-point cap.
   *
   * @param avgFps mean frame rate
   * @param minFps minimum frame rate
   * @return penalty in {@code [0, 30]}
   */
  double frameRatePenalty(double avgFps, double minFps) {
    double bandScore;
    if (avgFps < SEVERE_FRAME_RATE) {
      bandScore = 0d;
    } else if (avgFps < LOW_FRAME_RATE) {
      bandScore = 40d;
    } else if (avgFps < performance.minFrameRate()) {
      bandScore = 70d;
    } else {
      bandScore = 100d;
    }
    if (minFps < SEVERE_FRAME_RATE) {
      bandScore -= 20d;
    } else if (minFps < LOW_FRAME_RATE) {
      bandScore -= 10d;
    }
    bandScore = Math.max(0d, Math.min(100d, bandScore));
    return (100d - bandScore) * PERFORMANCE_PENALTY_CAP / 100d;
  }

  private List<PerformanceSample> recentPerformance(List<Snapshot> snapshots) {
    int from = Math.max(0, snapshots.size() - leak.trendWindow());
    List<PerformanceSample> samples = new ArrayList<>();
    for (Snapshot snapshot : snapshots.subList(from, snapshots.size())) {
      snapshot.performance().ifPresent(samples::add);
    }
    return samples;
  }
}
