package ca.gc.cra.soak.config;

/**
 * Thresholds applied by the leak analysis engine to snapshot series.
 *
 * @param maxMemoryGrowthMb growth from baseline above which memory is considered unstable
 * @param structuralGrowthThreshold element-count growth that raises a MEDIUM candidate
 * @param structuralGrowthHighThreshold element-count growth that raises a HIGH candidate
 * @param trendWindow number of most recent snapshots used for regression
 * @param trendMinConfidence minimum R&sup2; before an increasing trend becomes a candidate
 * @since SOAK 0.1
 */
public record LeakThresholds(
    double maxMemoryGrowthMb,
    long structuralGrowthThreshold,
    long structuralGrowthHighThreshold,
    int trendWindow,
    double trendMinConfidence) {

  /** Utilization percentage above which memory pressure is HIGH. */
  public static final double PRESSURE_HIGH_PERCENT = 85d;
  /** Utilization percentage above which memory pressure is CRITICAL. */
  public static final double PRESSURE_CRITICAL_PERCENT = 95d;

  /**
   * Returns the default thresholds.
   *
   * @return 100 MB growth, 100/500 elements, 10-snapshot window, 0.5 confidence
   */
  public static LeakThresholds defaults() {
    return new LeakThresholds(100d, 100L, 500L, 10, 0.5d);
  }

  void validate() {
    if (!(maxMemoryGrowthMb > 0)) {
      throw new ConfigurationException("leak.maxMemoryGrowthMb must be positive");
    }
    if (structuralGrowthThreshold <= 0 || structuralGrowthHighThreshold <= structuralGrowthThreshold) {
      throw new ConfigurationException(
          "leak.structuralGrowthThreshold must be positive and below leak.structuralGrowthHighThreshold");
    }
    if (trendWindow < 3) {
      throw new ConfigurationException("leak.trendWindow must be at least 3 (was " + trendWindow + ")");
    }
    if (trendMinConfidence < 0 || trendMinConfidence > 1) {
      throw new ConfigurationException("leak.trendMinConfidence must be within [0, 1]");
    }
  }
}
