package ca.gc.cra.soak.domain.metrics;

import java.util.Map;
import java.util.Objects;

/**
 * Structural element counts of the observed process (threads, loaded classes, DOM nodes, ...).
 *
 * @param elementCount aggregate count compared against the structural growth threshold
 * @param breakdown per-source counts for diagnostics
 * @since SOAK 0.1
 */
public record StructuralCounts(long elementCount, Map<String, Long> breakdown) {

  public StructuralCounts {
    if (elementCount < 0) {
      throw new IllegalArgumentException("elementCount must be non-negative");
    }
    breakdown = Map.copyOf(Objects.requireNonNull(breakdown, "breakdown"));
  }

  /**
   * Creates counts without a breakdown.
   *
   * @param elementCount aggregate count
   * @return structural counts
   */
  public static StructuralCounts of(long elementCount) {
    return new StructuralCounts(elementCount, Map.of());
  }
}
