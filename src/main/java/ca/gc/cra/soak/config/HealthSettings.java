package ca.gc.cra.soak.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Health scoring constants.
 *
 * @param minScore score below which a HEALTH_DEGRADED alert is raised
 * @param alertWindow how far back alerts count against the score
 * @param criticalAlertPenalty points deducted per critical alert in the window
 * @param highAlertPenalty points deducted per high alert in the window
 * @since SOAK 0.1
 */
public record HealthSettings(
    double minScore, Duration alertWindow, double criticalAlertPenalty, double highAlertPenalty) {

  public HealthSettings {
    Objects.requireNonNull(alertWindow, "alertWindow");
  }

  public static HealthSettings defaults() {
    return new HealthSettings(60d, Duration.ofMinutes(5), 10d, 5d);
  }

  void validate() {
    if (minScore < 0 || minScore > 100) {
      throw new ConfigurationException("health.minScore must be within [0, 100]");
    }
    if (alertWindow.isNegative() || alertWindow.isZero()) {
      throw new ConfigurationException("health.alertWindow must be positive");
    }
    if (criticalAlertPenalty < highAlertPenalty || highAlertPenalty < 0) {
      throw new ConfigurationException(
          "health alert penalties must be non-negative with critical >= high");
    }
  }
}
