package ca.gc.cra.soak.application.port;

import java.util.OptionalLong;

/**
 * Measures the current memory footprint of a tracked unit.
 *
 * @since SOAK 0.1
 */
@FunctionalInterface
public interface ComponentSizeProbe {
  /**
   * Estimates the size of {@code unitId}.
   *
   * @param unitId tracked unit identifier
   * @return size in bytes, or empty when the unit cannot be measured right now
   */
  OptionalLong sizeOf(String unitId);

  /** Probe that never measures; trackers then rely on sizes reported by the workload. */
  ComponentSizeProbe UNMEASURED = unitId -> OptionalLong.empty();
}
