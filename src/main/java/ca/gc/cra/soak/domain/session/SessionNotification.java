package ca.gc.cra.soak.domain.session;

/**
 * Read-only payload delivered to session subscribers.
 *
 * <p>Implemented by {@link ProgressReport}, {@link ca.gc.cra.soak.domain.analysis.Alert} and
 * {@link ca.gc.cra.soak.domain.analysis.HealthCheck}; {@link #kind()} identifies which one a
 * subscriber received.</p>
 *
 * @since SOAK 0.1
 */
public interface SessionNotification {
  /**
   * Returns the payload kind.
   *
   * @return notification kind
   */
  NotificationKind kind();

  /**
   * Returns the time the payload was produced.
   *
   * @return epoch milliseconds
   */
  long timestampMillis();
}
