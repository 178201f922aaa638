package ca.gc.cra.soak.application.monitor;

/**
 * Raised when leak or health analysis cannot process its input. Recoverable per cycle.
 *
 * @since SOAK 0.1
 */
public final class AnalysisException extends RuntimeException {
  public AnalysisException(String message) {
    super(message);
  }

  public AnalysisException(String message, Throwable cause) {
    super(message, cause);
  }
}
