package ca.gc.cra.soak.application.monitor;

import ca.gc.cra.soak.application.port.ClockPort;
import ca.gc.cra.soak.application.port.ComponentSizeProbe;
import ca.gc.cra.soak.application.port.MetricsPort;
import ca.gc.cra.soak.application.port.TaskScheduler;
import ca.gc.cra.soak.application.port.TaskScheduler.ScheduledTask;
import ca.gc.cra.soak.config.ComponentThresholds;
import ca.gc.cra.soak.domain.analysis.LeakCandidate;
import ca.gc.cra.soak.domain.metrics.MemorySample;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Follows each tracked unit from {@link #track} to {@link #untrack} and reports
 * abnormal growth.
 * <p><strong>Why:</strong> Units that grow while alive or keep memory after removal are the most common
 * source of slow leaks in long sessions.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Schedule one periodic re-measurement per unit; growth above the per-cycle threshold since the
 *   previous measurement yields a {@code COMPONENT_LEAK} candidate delivered to the sink.</li>
 *   <li>On removal, cancel the unit's monitor first, then compare the final size with the initial estimate;
 *   a delta in the MEDIUM band or above yields one candidate tagged {@code cleanup}.</li>
 *   <li>{@link #closeAll()} cancels every monitor and delta-checks every remaining unit.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Record bookkeeping is guarded by an internal lock; candidates are
 * delivered after the lock is released so sinks may take their own locks.</p>
 * <p><strong>Observability:</strong> {@code soak.component.tracked}, {@code soak.component.untracked},
 * {@code soak.component.candidates}.</p>
 *
 * @since SOAK 0.1
 */
public final class ComponentLifecycleTracker {
  private static final Logger log = LoggerFactory.getLogger(ComponentLifecycleTracker.class);

  private final Object lock = new Object();
  private final Map<String, ComponentRecord> records = new LinkedHashMap<>();
  private final LeakAnalysisEngine engine;
  private final ComponentThresholds thresholds;
  private final TaskScheduler scheduler;
  private final Duration checkInterval;
  private final ClockPort clock;
  private final ComponentSizeProbe sizeProbe;
  private final Consumer<LeakCandidate> sink;
  private final MetricsPort metrics;
  private boolean closed;

  /**
   * Creates a tracker.
   *
   * @param engine engine grading size deltas
   * @param thresholds size bands, including the per-cycle growth trigger
   * @param scheduler scheduler for per-unit monitors
   * @param checkInterval re-measurement cadence
   * @param clock time source
   * @param sizeProbe probe measuring unit sizes; {@link ComponentSizeProbe#UNMEASURED} when the workload
   *     reports sizes itself
   * @param sink receiver of candidates raised by periodic re-measurement
   * @param metrics metrics sink
   */
  public ComponentLifecycleTracker(
      LeakAnalysisEngine engine,
      ComponentThresholds thresholds,
      TaskScheduler scheduler,
      Duration checkInterval,
      ClockPort clock,
      ComponentSizeProbe sizeProbe,
      Consumer<LeakCandidate> sink,
      MetricsPort metrics) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.checkInterval = Objects.requireNonNull(checkInterval, "checkInterval");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sizeProbe = sizeProbe == null ? ComponentSizeProbe.UNMEASURED : sizeProbe;
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Registers a unit and starts its periodic re-measurement. Re-tracking an id replaces the old record
   * after delta-checking it.
   *
   * @param unitId unit identifier
   * @param initialSizeBytes size estimate at creation
   * @return candidate raised for a replaced record, if any
   * @throws IllegalStateException after {@link #closeAll()}
   */
  public Optional<LeakCandidate> track(String unitId, long initialSizeBytes) {
    Objects.requireNonNull(unitId, "unitId");
    if (initialSizeBytes < 0) {
      throw new IllegalArgumentException("initialSizeBytes must be non-negative");
    }
    Optional<LeakCandidate> replaced = Optional.empty();
    synchronized (lock) {
      if (closed) {
        throw new IllegalStateException("tracker is closed");
      }
      ComponentRecord previous = records.remove(unitId);
      if (previous != null) {
        previous.monitor.cancel();
        log.warn("Unit {} tracked twice; delta-checking the previous record", unitId);
        replaced = finalCheck(previous);
      }
      ComponentRecord record = new ComponentRecord(unitId, clock.nowMillis(), initialSizeBytes);
      record.monitor = scheduler.schedulePeriodic(
          "component-" + unitId, checkInterval, () -> remeasure(unitId));
      records.put(unitId, record);
    }
    metrics.increment("soak.component.tracked");
    log.debug("Tracking unit {} at {}", unitId, initialSizeBytes);
    return replaced;
  }

  /**
   * Records a size reported by the workload; used by the next re-measurement when no probe applies.
   *
   * @param unitId unit identifier
   * @param sizeBytes current size
   * @return {@code false} when the unit is not tracked
   */
  public boolean reportSize(String unitId, long sizeBytes) {
    synchronized (lock) {
      ComponentRecord record = records.get(unitId);
      if (record == null) {
        return false;
      }
      record.reportedSizeBytes = sizeBytes;
      return true;
    }
  }

  /**
   * Stops the unit's monitor, performs the final delta check against the initial estimate and deletes
   * the record.
   *
   * @param unitId unit identifier
   * @return candidate tagged {@code cleanup} when the delta reaches the MEDIUM band
   */
  public Optional<LeakCandidate> untrack(String unitId) {
    Objects.requireNonNull(unitId, "unitId");
    ComponentRecord record;
    synchronized (lock) {
      record = records.remove(unitId);
      if (record == null) {
        log.debug("Ignoring untrack of unknown unit {}", unitId);
        return Optional.empty();
      }
      record.monitor.cancel();
    }
    metrics.increment("soak.component.untracked");
    return finalCheck(record);
  }

  /**
   * Cancels every monitor and delta-checks every remaining unit. No re-measurement fires afterwards.
   *
   * @return cleanup candidates, in tracking order
   */
  public List<LeakCandidate> closeAll() {
    List<ComponentRecord> remaining;
    synchronized (lock) {
      closed = true;
      remaining = new ArrayList<>(records.values());
      records.clear();
      for (ComponentRecord record : remaining) {
        record.monitor.cancel();
      }
    }
    List<LeakCandidate> candidates = new ArrayList<>();
    for (ComponentRecord record : remaining) {
      finalCheck(record).ifPresent(candidates::add);
    }
    if (!remaining.isEmpty()) {
      log.info("Closed {} tracked units at session end ({} cleanup candidates)",
          remaining.size(), candidates.size());
    }
    return candidates;
  }

  public int trackedCount() {
    synchronized (lock) {
      return records.size();
    }
  }

  private void remeasure(String unitId) {
    Optional<LeakCandidate> candidate;
    synchronized (lock) {
      ComponentRecord record = records.get(unitId);
      if (closed || record == null || record.monitor.isCancelled()) {
        return;
      }
      long current = currentSize(record);
      double growthMb = (current - record.lastSizeBytes) / MemorySample.BYTES_PER_MB;
      record.lastSizeBytes = current;
      if (growthMb <= thresholds.perCycleGrowthMb()) {
        return;
      }
      candidate = engine.componentCandidate(unitId, growthMb, clock.nowMillis(), "");
    }
    candidate.ifPresent(c -> {
      metrics.increment("soak.component.candidates");
      log.warn("Unit {} grew {}MB since its previous measurement ({})",
          unitId, c.metrics().get("deltaMb"), c.severity());
      sink.accept(c);
    });
  }

  private Optional<LeakCandidate> finalCheck(ComponentRecord record) {
    long finalSize = currentSize(record);
    double deltaMb = (finalSize - record.initialSizeBytes) / MemorySample.BYTES_PER_MB;
    if (deltaMb < thresholds.mediumMb()) {
      return Optional.empty();
    }
    Optional<LeakCandidate> candidate =
        engine.componentCandidate(record.unitId, deltaMb, clock.nowMillis(), LeakCandidate.CLEANUP_TAG);
    candidate.ifPresent(c -> {
      metrics.increment("soak.component.candidates");
      log.warn("Unit {} retained {}MB at removal ({})", record.unitId, c.metrics().get("deltaMb"),
          c.severity());
    });
    return candidate;
  }

  private long currentSize(ComponentRecord record) {
    OptionalLong measured = sizeProbe.sizeOf(record.unitId);
    if (measured.isPresent()) {
      return measured.getAsLong();
    }
    return record.reportedSizeBytes >= 0 ? record.reportedSizeBytes : record.lastSizeBytes;
  }

  private static final class ComponentRecord {
    private final String unitId;
    private final long createdAtMillis;
    private final long initialSizeBytes;
    private long lastSizeBytes;
    private long reportedSizeBytes = -1L;
    private ScheduledTask monitor;

    private ComponentRecord(String unitId, long createdAtMillis, long initialSizeBytes) {
      this.unitId = unitId;
      this.createdAtMillis = createdAtMillis;
      this.initialSizeBytes = initialSizeBytes;
      this.lastSizeBytes = initialSizeBytes;
    }

    @Override
    public String toString() {
      return "ComponentRecord[" + unitId + ", createdAt=" + createdAtMillis + "]";
    }
  }
}
