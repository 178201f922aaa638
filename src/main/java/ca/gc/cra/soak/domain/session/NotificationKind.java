package ca.gc.cra.soak.domain.session;

/**
 * Closed set of notification payloads a session publishes to subscribers.
 *
 * @since SOAK 0.1
 */
public enum NotificationKind {
  PROGRESS,
  ALERT,
  HEALTH_CHECK
}
