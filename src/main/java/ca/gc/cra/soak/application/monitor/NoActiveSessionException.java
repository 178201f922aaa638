package ca.gc.cra.soak.application.monitor;

/**
 * Raised when a workload callback (track, untrack, operation) arrives while no session is running.
 *
 * @since SOAK 0.1
 */
public final class NoActiveSessionException extends IllegalStateException {
  public NoActiveSessionException(String message) {
    super(message);
  }
}
