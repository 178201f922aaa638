package ca.gc.cra.soak.application.monitor;

import ca.gc.cra.soak.domain.session.NotificationKind;

/**
 * Wraps a failure thrown by a notification subscriber. Logged by the dispatcher and never rethrown.
 *
 * @since SOAK 0.1
 */
public final class SubscriberException extends RuntimeException {
  private final NotificationKind kind;

  /**
   * Creates the wrapper.
   *
   * @param kind notification kind being delivered
   * @param cause subscriber failure
   */
  public SubscriberException(NotificationKind kind, Throwable cause) {
    super("Subscriber failed while handling " + kind + " notification", cause);
    this.kind = kind;
  }

  public NotificationKind kind() {
    return kind;
  }
}
