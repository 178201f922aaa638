package ca.gc.cra.soak.infrastructure.scheduling;

import ca.gc.cra.soak.application.port.TaskScheduler;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link TaskScheduler} backed by a {@link ScheduledExecutorService}.
 * <p><strong>Role:</strong> Production adapter for the scheduling port.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe. Callbacks are serialized only when the wrapped executor
 * has a single thread, see
 * {@link ca.gc.cra.soak.infrastructure.exec.ExecutorFactories#newSessionScheduler}.</p>
 * <p><strong>Failure handling:</strong> A callback that throws is logged and its periodic schedule keeps
 * running; the executor would otherwise suppress all later runs.</p>
 *
 * @since SOAK 0.1
 */
public final class ExecutorTaskScheduler implements TaskScheduler {
  private static final Logger log = LoggerFactory.getLogger(ExecutorTaskScheduler.class);

  private final ScheduledExecutorService executor;
  private final boolean ownsExecutor;

  /**
   * Wraps an executor.
   *
   * @param executor scheduled executor
   * @param ownsExecutor {@code true} to shut the executor down on {@link #close()}
   */
  public ExecutorTaskScheduler(ScheduledExecutorService executor, boolean ownsExecutor) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.ownsExecutor = ownsExecutor;
  }

  @Override
  public ScheduledTask schedulePeriodic(String name, Duration period, Runnable task) {
    Objects.requireNonNull(period, "period");
    if (period.isZero() || period.isNegative()) {
      throw new IllegalArgumentException("period must be positive");
    }
    long millis = period.toMillis();
    ScheduledFuture<?> future = executor.scheduleAtFixedRate(
        shielded(name, task), millis, millis, TimeUnit.MILLISECONDS);
    log.debug("Scheduled {} every {}ms", name, millis);
    return new FutureTask(future);
  }

  @Override
  public ScheduledTask scheduleOnce(String name, Duration delay, Runnable task) {
    Objects.requireNonNull(delay, "delay");
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative");
    }
    ScheduledFuture<?> future =
        executor.schedule(shielded(name, task), delay.toMillis(), TimeUnit.MILLISECONDS);
    return new FutureTask(future);
  }

  @Override
  public void close() {
    if (ownsExecutor) {
      executor.shutdownNow();
    }
  }

  private static Runnable shielded(String name, Runnable task) {
    Objects.requireNonNull(task, "task");
    return () -> {
      try {
        task.run();
      } catch (RuntimeException ex) {
        log.error("Scheduled task {} failed", name, ex);
      }
    };
  }

  private static final class FutureTask implements ScheduledTask {
    private final ScheduledFuture<?> future;

    private FutureTask(ScheduledFuture<?> future) {
      this.future = future;
    }

    @Override
    public void cancel() {
      future.cancel(false);
    }

    @Override
    public boolean isCancelled() {
      return future.isCancelled();
    }
  }
}
