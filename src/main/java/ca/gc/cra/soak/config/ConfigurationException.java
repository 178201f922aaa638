package ca.gc.cra.soak.config;

/**
 * Raised when session configuration is missing, malformed or violates an invariant.
 *
 * @since SOAK 0.1
 */
public class ConfigurationException extends IllegalArgumentException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public ConfigurationException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and cause.
   *
   * @param message human-readable error
   * @param cause underlying parse or validation failure
   */
  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
