package ca.gc.cra.soak.domain.analysis;

/**
 * Result reported by a remediation hook.
 *
 * @param success whether the remediation ran to completion
 * @param reclaimedBytes memory released by the remediation; {@code 0} when unknown
 * @param message short description
 * @since SOAK 0.1
 */
public record RemediationOutcome(boolean success, long reclaimedBytes, String message) {
  public RemediationOutcome {
    message = message == null ? "" : message;
  }

  /**
   * Outcome recorded when the hook itself failed.
   *
   * @param message failure description
   * @return unsuccessful outcome with nothing reclaimed
   */
  public static RemediationOutcome failed(String message) {
    return new RemediationOutcome(false, 0L, message);
  }
}
