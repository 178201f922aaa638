package ca.gc.cra.soak.application.port;

/**
 * Supplies wall-clock time to session use cases so that scheduling and trend math stay testable.
 *
 * @since SOAK 0.1
 */
public interface ClockPort {
  /**
   * Returns the current time in epoch milliseconds.
   *
   * @return current time in milliseconds since the Unix epoch
   */
  long nowMillis();

  /** Clock backed by {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
