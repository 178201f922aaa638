package ca.gc.cra.soak.application.port;

import ca.gc.cra.soak.domain.analysis.Alert;
import ca.gc.cra.soak.domain.analysis.RemediationOutcome;

/**
 * External reaction to high-severity alerts, such as requesting a garbage collection.
 *
 * @since SOAK 0.1
 */
@FunctionalInterface
public interface RemediationHook {
  /**
   * Reacts to {@code alert}.
   *
   * @param alert alert with severity of at least {@code HIGH}
   * @return outcome recorded into the session data
   * @throws Exception when remediation fails; the failure is logged and recorded as unsuccessful
   */
  RemediationOutcome remediate(Alert alert) throws Exception;
}
