package ca.gc.cra.soak.domain.analysis;

/**
 * Classification of a memory slope in MB/hour.
 *
 * @since SOAK 0.1
 */
public enum TrendDirection {
  STABLE,
  INCREASING_MODERATELY,
  INCREASING_RAPIDLY,
  DECREASING_MODERATELY,
  DECREASING_RAPIDLY;

  private static final double MODERATE_MB_PER_HOUR = 5d;
  private static final double RAPID_MB_PER_HOUR = 10d;

  /**
   * Classifies a slope against the fixed bands (&plusmn;5 and &plusmn;10 MB/hour).
   *
   * @param slopeMbPerHour regression slope
   * @return trend direction
   */
  public static TrendDirection classify(double slopeMbPerHour) {
    if (slopeMbPerHour > RAPID_MB_PER_HOUR) {
      return INCREASING_RAPIDLY;
    }
    if (slopeMbPerHour > MODERATE_MB_PER_HOUR) {
      return INCREASING_MODERATELY;
    }
    if (slopeMbPerHour < -RAPID_MB_PER_HOUR) {
      return DECREASING_RAPIDLY;
    }
    if (slopeMbPerHour < -MODERATE_MB_PER_HOUR) {
      return DECREASING_MODERATELY;
    }
    return STABLE;
  }

  /**
   * Reports whether the direction indicates growth.
   *
   * @return {@code true} for the increasing bands
   */
  public boolean isIncreasing() {
    return this == INCREASING_MODERATELY || this == INCREASING_RAPIDLY;
  }
}
