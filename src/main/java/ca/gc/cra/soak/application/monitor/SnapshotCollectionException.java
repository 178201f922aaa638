package ca.gc.cra.soak.application.monitor;

/**
 * Checked exception thrown when a metrics read fails or exceeds its timeout.
 *
 * <p>During a running session the orchestrator logs it and skips the cycle; during {@code start} it is
 * surfaced to the caller.</p>
 *
 * @since SOAK 0.1
 */
public final class SnapshotCollectionException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public SnapshotCollectionException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause provider failure or timeout
   */
  public SnapshotCollectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
