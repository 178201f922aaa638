package ca.gc.cra.soak.domain.analysis;

/**
 * Banded interpretation of a health score.
 *
 * @since SOAK 0.1
 */
public enum HealthStatus {
  EXCELLENT,
  GOOD,
  FAIR,
  POOR,
  CRITICAL,
  FAILING;

  /**
   * Maps a score onto its band (90, 80, 70, 60, 40 cutoffs).
   *
   * @param score health score in {@code [0, 100]}
   * @return status band
   */
  public static HealthStatus fromScore(double score) {
    if (score >= 90) {
      return EXCELLENT;
    }
    if (score >= 80) {
      return GOOD;
    }
    if (score >= 70) {
      return FAIR;
    }
    if (score >= 60) {
      return POOR;
    }
    if (score >= 40) {
      return CRITICAL;
    }
    return FAILING;
  }
}
