package ca.gc.cra.soak.config;

import ca.gc.cra.soak.domain.analysis.Severity;
import ca.gc.cra.soak.validation.Numbers;
import java.util.Optional;

/**
 * Size-delta bands (MB) used to grade tracked-unit growth.
 *
 * <p>Deltas below {@code lowMb} are ignored; {@code [low, medium)} is LOW, {@code [medium, high)} is
 * MEDIUM, {@code [high, critical]} is HIGH and anything above {@code criticalMb} is CRITICAL.</p>
 *
 * @param lowMb smallest delta reported at all
 * @param mediumMb start of the MEDIUM band
 * @param highMb start of the HIGH band
 * @param criticalMb deltas strictly above this are CRITICAL
 * @param perCycleGrowthMb growth between two periodic re-measurements that triggers a candidate
 * @since SOAK 0.1
 */
public record ComponentThresholds(
    double lowMb, double mediumMb, double highMb, double criticalMb, double perCycleGrowthMb) {

  /**
   * Returns the default bands: 5, 10, 20 and 50 MB with a 10 MB per-cycle trigger.
   *
   * @return default thresholds
   */
  public static ComponentThresholds defaults() {
    return new ComponentThresholds(5d, 10d, 20d, 50d, 10d);
  }

  /**
   * Grades a size delta.
   *
   * @param deltaMb growth in MB
   * @return severity, or empty when the delta is below {@link #lowMb()}
   */
  public Optional<Severity> classify(double deltaMb) {
    if (deltaMb > criticalMb) {
      return Optional.of(Severity.CRITICAL);
    }
    if (deltaMb >= highMb) {
      return Optional.of(Severity.HIGH);
    }
    if (deltaMb >= mediumMb) {
      return Optional.of(Severity.MEDIUM);
    }
    if (deltaMb >= lowMb) {
      return Optional.of(Severity.LOW);
    }
    return Optional.empty();
  }

  void validate() {
    try {
      Numbers.requireIncreasing("leak.component", lowMb, mediumMb, highMb, criticalMb);
      Numbers.requireIncreasing("leak.component.perCycleGrowthMb", perCycleGrowthMb);
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException(ex.getMessage(), ex);
    }
  }
}
