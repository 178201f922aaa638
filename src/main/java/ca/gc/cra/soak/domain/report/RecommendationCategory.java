package ca.gc.cra.soak.domain.report;

/**
 * Issue categories a final report can recommend action on.
 *
 * @since SOAK 0.1
 */
public enum RecommendationCategory {
  MEMORY,
  PERFORMANCE,
  HEALTH,
  MEMORY_LEAKS,
  ALERTS,
  DATA_QUALITY
}
