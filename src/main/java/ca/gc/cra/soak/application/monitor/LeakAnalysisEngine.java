package ca.gc.cra.soak.application.monitor;

import ca.gc.cra.soak.config.ComponentThresholds;
import ca.gc.cra.soak.config.LeakThresholds;
import ca.gc.cra.soak.domain.analysis.LeakCandidate;
import ca.gc.cra.soak.domain.analysis.LeakType;
import ca.gc.cra.soak.domain.analysis.Severity;
import ca.gc.cra.soak.domain.analysis.TrendAnalysis;
import ca.gc.cra.soak.domain.analysis.TrendDirection;
import ca.gc.cra.soak.domain.metrics.MemorySample;
import ca.gc.cra.soak.domain.metrics.Snapshot;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Regression and threshold analysis over snapshot series and component deltas.
 * <p><strong>Role:</strong> Stateless domain service used by the orchestrator, the lifecycle tracker and the
 * report generator.</p>
 * <p><strong>Determinism:</strong> Every method is a pure function of its arguments and the thresholds
 * supplied at construction; repeated calls with the same input yield equal results.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * @since SOAK 0.1
 */
public final class LeakAnalysisEngine {
  private static final double MILLIS_PER_HOUR = 3_600_000d;
  private static final int MIN_TREND_SAMPLES = 3;
  private static final int MANY_CANDIDATES = 3;

  private final LeakThresholds thresholds;
  private final ComponentThresholds componentThresholds;

  /**
   * Creates an engine.
   *
   * @param thresholds snapshot-series thresholds
   * @param componentThresholds tracked-unit size bands
   */
  public LeakAnalysisEngine(LeakThresholds thresholds, ComponentThresholds componentThresholds) {
    this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    this.componentThresholds = Objects.requireNonNull(componentThresholds, "componentThresholds");
  }

  /**
   * Fits a least-squares line of used memory (MB) against time (hours) over the most recent
   * {@code trendWindow} snapshots.
   *
   * @param series snapshots in non-decreasing timestamp order
   * @return slope, R&sup2; confidence and direction; {@link TrendAnalysis#insufficient(int)} with fewer
   *     than three snapshots or when all snapshots share one timestamp
   * @throws AnalysisException when the series is out of order
   */
  public TrendAnalysis analyzeTrend(List<Snapshot> series) {
    Objects.requireNonNull(series, "series");
    int from = Math.max(0, series.size() - thresholds.trendWindow());
    List<Snapshot> window = series.subList(from, series.size());
    int n = window.size();
    if (n < MIN_TREND_SAMPLES) {
      return TrendAnalysis.insufficient(n);
    }

    long origin = window.get(0).timestampMillis();
    double[] x = new double[n];
    double[] y = new double[n];
    long previous = origin;
    for (int i = 0; i < n; i++) {
      Snapshot snapshot = window.get(i);
      if (snapshot.timestampMillis() < previous) {
        throw new AnalysisException("snapshot series is not ordered by timestamp");
      }
      previous = snapshot.timestampMillis();
      x[i] = (snapshot.timestampMillis() - origin) / MILLIS_PER_HOUR;
      y[i] = snapshot.usedMb();
    }

    double meanX = mean(x);
    double meanY = mean(y);
    double sxx = 0d;
    double sxy = 0d;
    double syy = 0d;
    for (int i = 0; i < n; i++) {
      double dx = x[i] - meanX;
      double dy = y[i] - meanY;
      sxx += dx * dx;
      sxy += dx * dy;
      syy += dy * dy;
    }
    if (sxx == 0d) {
      return TrendAnalysis.insufficient(n);
    }

    double slope = sxy / sxx;
    double intercept = meanY - slope * meanX;
    double ssRes = 0d;
    for (int i = 0; i < n; i++) {
      double residual = y[i] - (intercept + slope * x[i]);
      ssRes += residual * residual;
    }
    double rSquared = syy == 0d ? 1d : 1d - ssRes / syy;
    double confidence = Math.max(0d, Math.min(1d, rSquared));
    return new TrendAnalysis(slope, confidence, TrendDirection.classify(slope), n, true);
  }

  /**
   * Converts an increasing trend into a candidate once its confidence reaches the configured minimum.
   *
   * @param trend trend analysis
   * @param detectedAtMillis detection time
   * @return HIGH for rapid growth, MEDIUM for moderate growth, otherwise empty
   */
  public Optional<LeakCandidate> trendCandidate(TrendAnalysis trend, long detectedAtMillis) {
    Objects.requireNonNull(trend, "trend");
    if (!trend.sufficient()
        || !trend.direction().isIncreasing()
        || trend.confidence() < thresholds.trendMinConfidence()) {
      return Optional.empty();
    }
    Severity severity =
        trend.direction() == TrendDirection.INCREASING_RAPIDLY ? Severity.HIGH : Severity.MEDIUM;
    return Optional.of(LeakCandidate.of(
        LeakType.TREND_GROWTH,
        severity,
        detectedAtMillis,
        Map.of(
            "slopeMbPerHour", format(trend.slopeMbPerHour()),
            "confidence", format(trend.confidence()),
            "samples", Integer.toString(trend.sampleCount())),
        "Memory is trending upward; profile allocation hot spots and retained objects"));
  }

  /**
   * Checks one snapshot against the baseline: overall growth, memory pressure and structural growth.
   *
   * @param snapshot snapshot to analyze
   * @param baseline session baseline
   * @return zero to three candidates, one per failed check
   * @throws AnalysisException when {@code snapshot} predates {@code baseline}
   */
  public List<LeakCandidate> analyzeSnapshot(Snapshot snapshot, Snapshot baseline) {
    Objects.requireNonNull(snapshot, "snapshot");
    Objects.requireNonNull(baseline, "baseline");
    if (snapshot.timestampMillis() < baseline.timestampMillis()) {
      throw new AnalysisException("snapshot predates baseline");
    }
    long detectedAt = snapshot.timestampMillis();
    List<LeakCandidate> candidates = new ArrayList<>(3);

    double growthMb =
        (snapshot.memory().usedBytes() - baseline.memory().usedBytes()) / MemorySample.BYTES_PER_MB;
    double maxGrowth = thresholds.maxMemoryGrowthMb();
    if (growthMb > maxGrowth) {
      Severity severity = growthMb > maxGrowth * 2 ? Severity.CRITICAL : Severity.HIGH;
      candidates.add(LeakCandidate.of(
          LeakType.TREND_GROWTH,
          severity,
          detectedAt,
          Map.of("growthMb", format(growthMb), "thresholdMb", format(maxGrowth)),
          "Memory grew beyond the allowed limit; check for unreleased listeners, timers and caches"));
    }

    double utilization = snapshot.utilizationPercent();
    if (utilization > LeakThresholds.PRESSURE_HIGH_PERCENT) {
      Severity severity = utilization > LeakThresholds.PRESSURE_CRITICAL_PERCENT
          ? Severity.CRITICAL
          : Severity.HIGH;
      candidates.add(LeakCandidate.of(
          LeakType.MEMORY_PRESSURE,
          severity,
          detectedAt,
          Map.of("utilizationPercent", format(utilization)),
          "Memory is close to capacity; reduce retained data or raise the memory limit"));
    }

    long structuralGrowth = snapshot.structure().elementCount() - baseline.structure().elementCount();
    if (structuralGrowth > thresholds.structuralGrowthThreshold()) {
      Severity severity = structuralGrowth > thresholds.structuralGrowthHighThreshold()
          ? Severity.HIGH
          : Severity.MEDIUM;
      candidates.add(LeakCandidate.of(
          LeakType.STRUCTURAL_GROWTH,
          severity,
          detectedAt,
          Map.of(
              "elementGrowth", Long.toString(structuralGrowth),
              "threshold", Long.toString(thresholds.structuralGrowthThreshold())),
          "Structural element count keeps growing; verify elements are released when units close"));
    }
    return List.copyOf(candidates);
  }

  /**
   * Grades a tracked-unit size delta.
   *
   * @param unitId tracked unit
   * @param deltaMb growth in MB
   * @param detectedAtMillis detection time
   * @param tag qualifier such as {@link LeakCandidate#CLEANUP_TAG}, or empty
   * @return candidate when the delta reaches the LOW band
   */
  public Optional<LeakCandidate> componentCandidate(
      String unitId, double deltaMb, long detectedAtMillis, String tag) {
    Objects.requireNonNull(unitId, "unitId");
    return componentThresholds.classify(deltaMb).map(severity -> new LeakCandidate(
        LeakType.COMPONENT_LEAK,
        severity,
        detectedAtMillis,
        Map.of("unitId", unitId, "deltaMb", format(deltaMb)),
        LeakCandidate.CLEANUP_TAG.equals(tag)
            ? "Unit kept memory after removal; release its subscriptions, timers and buffers on close"
            : "Unit grew between measurements; bound its internal collections",
        tag));
  }

  /**
   * Collapses the candidates of one cycle into a single severity: any CRITICAL gives CRITICAL; any HIGH
   * or more than three candidates gives HIGH; more than one gives MEDIUM; otherwise LOW.
   *
   * @param candidates candidates of one cycle
   * @return aggregated severity
   */
  public static Severity overallSeverity(Collection<LeakCandidate> candidates) {
    Objects.requireNonNull(candidates, "candidates");
    boolean anyHigh = false;
    for (LeakCandidate candidate : candidates) {
      if (candidate.severity() == Severity.CRITICAL) {
        return Severity.CRITICAL;
      }
      anyHigh |= candidate.severity() == Severity.HIGH;
    }
    if (anyHigh || candidates.size() > MANY_CANDIDATES) {
      return Severity.HIGH;
    }
    if (candidates.size() > 1) {
      return Severity.MEDIUM;
    }
    return Severity.LOW;
  }

  public LeakThresholds thresholds() {
    return thresholds;
  }

  private static double mean(double[] values) {
    double sum = 0d;
    for (double value : values) {
      sum += value;
    }
    return sum / values.length;
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }
}
