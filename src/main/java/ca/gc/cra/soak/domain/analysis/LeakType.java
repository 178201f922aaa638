package ca.gc.cra.soak.domain.analysis;

/**
 * Kinds of anomalous growth the analysis engine and lifecycle tracker report.
 *
 * @since SOAK 0.1
 */
public enum LeakType {
  /** Sustained upward regression slope over recent snapshots. */
  TREND_GROWTH,
  /** Utilization close to capacity. */
  MEMORY_PRESSURE,
  /** A tracked unit grew between measurements or kept memory after removal. */
  COMPONENT_LEAK,
  /** Structural element counts grew past the configured threshold. */
  STRUCTURAL_GROWTH
}
