package ca.gc.cra.soak.application.monitor;

import ca.gc.cra.soak.application.port.ClockPort;
import ca.gc.cra.soak.application.port.MetricsPort;
import ca.gc.cra.soak.application.port.MetricsProvider;
import ca.gc.cra.soak.domain.metrics.MemorySample;
import ca.gc.cra.soak.domain.metrics.PerformanceSample;
import ca.gc.cra.soak.domain.metrics.Snapshot;
import ca.gc.cra.soak.domain.metrics.StructuralCounts;
import ca.gc.cra.soak.logging.Logs;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns raw {@link MetricsProvider} readings into {@link Snapshot}s relative to a
 * session baseline.
 * <p><strong>Why:</strong> Provider reads may block (cgroup files, remote agents); running them on a probe
 * executor with a bounded wait keeps one slow read from stalling the session.</p>
 * <p><strong>Role:</strong> Leaf use case driven by {@link SessionOrchestrator} on the snapshot cadence.</p>
 * <p><strong>Thread-safety:</strong> {@link #establishBaseline(int)} and {@link #takeSnapshot(int)} are
 * synchronized so timestamps stay non-decreasing even when a final snapshot races a scheduled one.</p>
 * <p><strong>Observability:</strong> Increments {@code soak.snapshot.taken} and {@code soak.snapshot.failed};
 * observes {@code soak.snapshot.usedMb} and {@code soak.snapshot.readMillis}.</p>
 *
 * @since SOAK 0.1
 */
public final class SnapshotCollector {
  private static final Logger log = LoggerFactory.getLogger(SnapshotCollector.class);

  private final MetricsProvider provider;
  private final ClockPort clock;
  private final Executor probeExecutor;
  private final Duration timeout;
  private final MetricsPort metrics;

  private Snapshot baseline;
  private long lastTimestampMillis = Long.MIN_VALUE;

  /**
   * Creates a collector.
   *
   * @param provider host metrics capability
   * @param clock time source for snapshot timestamps
   * @param probeExecutor executor running provider reads; a direct executor reads inline
   * @param timeout maximum wait for one read
   * @param metrics metrics sink; {@code null} falls back to {@link MetricsPort#NO_OP}
   */
  public SnapshotCollector(
      MetricsProvider provider,
      ClockPort clock,
      Executor probeExecutor,
      Duration timeout,
      MetricsPort metrics) {
    this.provider = Objects.requireNonNull(provider, "provider");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.probeExecutor = Objects.requireNonNull(probeExecutor, "probeExecutor");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Captures the reference snapshot for the session. Growth figures of later snapshots are measured
   * against it.
   *
   * @param trackedUnitCount units tracked at start
   * @return baseline snapshot with zero growth
   * @throws SnapshotCollectionException when the read fails or times out
   */
  public synchronized Snapshot establishBaseline(int trackedUnitCount) throws SnapshotCollectionException {
    Reading reading = read();
    long timestamp = nextTimestamp();
    baseline = new Snapshot(
        timestamp,
        reading.memory(),
        reading.structure(),
        trackedUnitCount,
        0L,
        0L,
        reading.performance(),
        reading.openHandles());
    log.info("Baseline established: used={} utilization={}",
        Logs.megabytes(baseline.memory().usedBytes()), Logs.percent(baseline.utilizationPercent()));
    metrics.increment("soak.snapshot.taken");
    return baseline;
  }

  /**
   * Captures a snapshot relative to the baseline.
   *
   * @param trackedUnitCount units currently tracked
   * @return new snapshot
   * @throws SnapshotCollectionException when the read fails, times out, or no baseline exists
   */
  public synchronized Snapshot takeSnapshot(int trackedUnitCount) throws SnapshotCollectionException {
    if (baseline == null) {
      throw new SnapshotCollectionException("baseline has not been established");
    }
    Reading reading = read();
    long timestamp = nextTimestamp();
    Snapshot snapshot = new Snapshot(
        timestamp,
        reading.memory(),
        reading.structure(),
        trackedUnitCount,
        reading.memory().usedBytes() - baseline.memory().usedBytes(),
        reading.structure().elementCount() - baseline.structure().elementCount(),
        reading.performance(),
        reading.openHandles());
    metrics.increment("soak.snapshot.taken");
    metrics.observe("soak.snapshot.usedMb", Math.round(snapshot.usedMb()));
    if (log.isDebugEnabled()) {
      log.debug("Snapshot used={}MB growth={}MB units={}",
          Math.round(snapshot.usedMb()), Math.round(snapshot.growthFromBaselineMb()), trackedUnitCount);
    }
    return snapshot;
  }

  /**
   * Returns the baseline.
   *
   * @return baseline snapshot, or empty before {@link #establishBaseline(int)}
   */
  public synchronized Optional<Snapshot> baseline() {
    return Optional.ofNullable(baseline);
  }

  private Reading read() throws SnapshotCollectionException {
    long started = System.nanoTime();
    CompletableFuture<Reading> future = CompletableFuture.supplyAsync(this::readProvider, probeExecutor);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      metrics.increment("soak.snapshot.failed");
      throw new SnapshotCollectionException("metrics read exceeded " + timeout.toMillis() + "ms", ex);
    } catch (ExecutionException ex) {
      metrics.increment("soak.snapshot.failed");
      Throwable cause = ex.getCause() instanceof CompletionException completion
          && completion.getCause() != null ? completion.getCause() : ex.getCause();
      throw new SnapshotCollectionException("metrics read failed: " + cause, cause);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      metrics.increment("soak.snapshot.failed");
      throw new SnapshotCollectionException("interrupted while reading metrics", ex);
    } finally {
      metrics.observe("soak.snapshot.readMillis", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
    }
  }

  private Reading readProvider() {
    try {
      MemorySample memory = Objects.requireNonNull(provider.sampleMemory(), "memory sample");
      StructuralCounts structure =
          Objects.requireNonNull(provider.sampleStructuralCounts(), "structural counts");
      Optional<PerformanceSample> performance = provider.samplePerformance();
      OptionalLong handles = provider.probeOpenHandles();
      return new Reading(
          memory,
          structure,
          performance == null ? Optional.empty() : performance,
          handles == null ? OptionalLong.empty() : handles);
    } catch (RuntimeException ex) {
      throw ex;
    } catch (Exception ex) {
      throw new CompletionException(ex);
    }
  }

  // Strictly increasing: a stalled or backwards clock advances by one millisecond per snapshot.
  private long nextTimestamp() {
    long now = clock.nowMillis();
    lastTimestampMillis = lastTimestampMillis == Long.MIN_VALUE
        ? now
        : Math.max(lastTimestampMillis + 1, now);
    return lastTimestampMillis;
  }

  private record Reading(
      MemorySample memory,
      StructuralCounts structure,
      Optional<PerformanceSample> performance,
      OptionalLong openHandles) {}
}
