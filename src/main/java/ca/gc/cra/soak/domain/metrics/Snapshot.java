package ca.gc.cra.soak.domain.metrics;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Immutable point-in-time measurement taken during a session.
 *
 * @param timestampMillis capture time in epoch milliseconds
 * @param memory memory reading
 * @param structure structural counts
 * @param trackedUnitCount number of tracked units at capture time
 * @param growthFromBaselineBytes used-memory delta against the session baseline
 * @param structuralGrowthFromBaseline element-count delta against the session baseline
 * @param performance performance reading when the host exposes one
 * @param openHandles best-effort handle count; empty when unknown
 * @since SOAK 0.1
 */
public record Snapshot(
    long timestampMillis,
    MemorySample memory,
    StructuralCounts structure,
    int trackedUnitCount,
    long growthFromBaselineBytes,
    long structuralGrowthFromBaseline,
    Optional<PerformanceSample> performance,
    OptionalLong openHandles) {

  public Snapshot {
    Objects.requireNonNull(memory, "memory");
    Objects.requireNonNull(structure, "structure");
    Objects.requireNonNull(performance, "performance");
    Objects.requireNonNull(openHandles, "openHandles");
    if (trackedUnitCount < 0) {
      throw new IllegalArgumentException("trackedUnitCount must be non-negative");
    }
  }

  /**
   * Returns used memory in MB.
   *
   * @return used megabytes
   */
  public double usedMb() {
    return memory.usedMb();
  }

  /**
   * Returns utilization as a percentage.
   *
   * @return utilization percentage
   */
  public double utilizationPercent() {
    return memory.utilizationPercent();
  }

  /**
   * Returns growth from the baseline in MB.
   *
   * @return growth in megabytes; negative when memory shrank
   */
  public double growthFromBaselineMb() {
    return growthFromBaselineBytes / MemorySample.BYTES_PER_MB;
  }
}
