package ca.gc.cra.soak.domain.analysis;

import java.util.Objects;

/**
 * Remediation attempt linked to the alert that triggered it.
 *
 * @param alertId triggering alert
 * @param timestampMillis attempt time
 * @param outcome hook result
 * @since SOAK 0.1
 */
public record RemediationRecord(String alertId, long timestampMillis, RemediationOutcome outcome) {
  public RemediationRecord {
    Objects.requireNonNull(alertId, "alertId");
    Objects.requireNonNull(outcome, "outcome");
  }
}
