package ca.gc.cra.soak.domain.analysis;

import java.util.Objects;

/**
 * Result of a linear regression over recent snapshots.
 *
 * @param slopeMbPerHour fitted growth rate
 * @param confidence coefficient of determination clamped to {@code [0, 1]}
 * @param direction slope classification
 * @param sampleCount number of snapshots in the fit
 * @param sufficient {@code false} when too few snapshots were available to fit
 * @since SOAK 0.1
 */
public record TrendAnalysis(
    double slopeMbPerHour,
    double confidence,
    TrendDirection direction,
    int sampleCount,
    boolean sufficient) {

  public TrendAnalysis {
    Objects.requireNonNull(direction, "direction");
  }

  /**
   * Result used when the series is too short to fit.
   *
   * @param sampleCount number of snapshots available
   * @return stable, zero-confidence analysis flagged as insufficient
   */
  public static TrendAnalysis insufficient(int sampleCount) {
    return new TrendAnalysis(0d, 0d, TrendDirection.STABLE, sampleCount, false);
  }
}
