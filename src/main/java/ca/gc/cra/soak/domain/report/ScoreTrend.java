package ca.gc.cra.soak.domain.report;

import java.util.List;

/**
 * Direction of the health score over the most recent checks.
 *
 * @since SOAK 0.1
 */
public enum ScoreTrend {
  IMPROVING,
  DECLINING,
  STABLE,
  INSUFFICIENT_DATA;

  static final int WINDOW = 3;
  static final double THRESHOLD = 5d;

  /**
   * Compares the first and last of the latest three scores; a move of more than five points in
   * either direction is a trend.
   *
   * @param scores scores in check order
   * @return trend, or {@link #INSUFFICIENT_DATA} with fewer than three scores
   */
  public static ScoreTrend of(List<Double> scores) {
    if (scores.size() < WINDOW) {
      return INSUFFICIENT_DATA;
    }
    double first = scores.get(scores.size() - WINDOW);
    double last = scores.get(scores.size() - 1);
    if (last > first + THRESHOLD) {
      return IMPROVING;
    }
    if (last < first - THRESHOLD) {
      return DECLINING;
    }
    return STABLE;
  }
}
