package ca.gc.cra.soak.domain.analysis;

/**
 * Alert categories raised during a session.
 *
 * @since SOAK 0.1
 */
public enum AlertType {
  /** Aggregated leak candidates from one snapshot cycle. */
  MEMORY_LEAK,
  /** A single tracked unit leaked or grew abnormally. */
  COMPONENT_LEAK,
  /** Health score fell below the configured minimum. */
  HEALTH_DEGRADED
}
