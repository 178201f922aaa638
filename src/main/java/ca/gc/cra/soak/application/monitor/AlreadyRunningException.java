package ca.gc.cra.soak.application.monitor;

/**
 * Raised by {@code start} when a session is already active for the orchestrator or its registry.
 *
 * @since SOAK 0.1
 */
public final class AlreadyRunningException extends IllegalStateException {
  public AlreadyRunningException(String message) {
    super(message);
  }
}
