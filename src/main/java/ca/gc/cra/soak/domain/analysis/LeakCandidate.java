package ca.gc.cra.soak.domain.analysis;

import java.util.Map;
import java.util.Objects;

/**
 * Detected anomalous growth pattern.
 *
 * @param type leak category
 * @param severity graded severity
 * @param detectedAtMillis detection time in epoch milliseconds
 * @param metrics figures that triggered the detection
 * @param recommendation operator guidance
 * @param tag optional qualifier such as {@code cleanup}; empty string when absent
 * @since SOAK 0.1
 */
public record LeakCandidate(
    LeakType type,
    Severity severity,
    long detectedAtMillis,
    Map<String, String> metrics,
    String recommendation,
    String tag) {

  /** Tag applied to candidates raised by the final check of an untracked unit. */
  public static final String CLEANUP_TAG = "cleanup";

  public LeakCandidate {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(severity, "severity");
    metrics = Map.copyOf(Objects.requireNonNull(metrics, "metrics"));
    recommendation = recommendation == null ? "" : recommendation;
    tag = tag == null ? "" : tag;
  }

  /**
   * Creates an untagged candidate.
   *
   * @param type leak category
   * @param severity graded severity
   * @param detectedAtMillis detection time
   * @param metrics triggering figures
   * @param recommendation operator guidance
   * @return leak candidate
   */
  public static LeakCandidate of(
      LeakType type,
      Severity severity,
      long detectedAtMillis,
      Map<String, String> metrics,
      String recommendation) {
    return new LeakCandidate(type, severity, detectedAtMillis, metrics, recommendation, "");
  }
}
