package ca.gc.cra.soak.application.port;

import java.time.Duration;

/**
 * Schedules the periodic and one-shot callbacks that drive a monitoring session.
 *
 * <p>Callbacks submitted through one scheduler must never run concurrently with each other; a
 * single logical thread is sufficient for every cadence the monitor uses.</p>
 *
 * @since SOAK 0.1
 */
public interface TaskScheduler extends AutoCloseable {

  /**
   * Runs {@code task} every {@code period}, first after one full period.
   *
   * @param name diagnostic task name
   * @param period interval between runs; must be positive
   * @param task callback to execute
   * @return handle used to cancel the task
   */
  ScheduledTask schedulePeriodic(String name, Duration period, Runnable task);

  /**
   * Runs {@code task} once after {@code delay}.
   *
   * @param name diagnostic task name
   * @param delay delay before execution; must not be negative
   * @param task callback to execute
   * @return handle used to cancel the task
   */
  ScheduledTask scheduleOnce(String name, Duration delay, Runnable task);

  /**
   * Releases scheduler resources without waiting for in-flight callbacks.
   */
  @Override
  default void close() {}

  /**
   * Cancellation handle for a scheduled callback.
   */
  interface ScheduledTask {
    /**
     * Prevents any further execution of the task. Idempotent.
     */
    void cancel();

    /**
     * Reports whether {@link #cancel()} has been called.
     *
     * @return {@code true} once cancelled
     */
    boolean isCancelled();
  }
}
