package ca.gc.cra.soak.domain.analysis;

/**
 * Ordered severity scale shared by leak candidates, alerts and recommendations.
 *
 * @since SOAK 0.1
 */
public enum Severity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  /**
   * Tests whether this severity is at least {@code other}.
   *
   * @param other threshold severity
   * @return {@code true} when {@code this >= other}
   */
  public boolean atLeast(Severity other) {
    return compareTo(other) >= 0;
  }

  /**
   * Returns the more severe of two values.
   *
   * @param a first severity
   * @param b second severity
   * @return the higher severity
   */
  public static Severity max(Severity a, Severity b) {
    return a.compareTo(b) >= 0 ? a : b;
  }
}
