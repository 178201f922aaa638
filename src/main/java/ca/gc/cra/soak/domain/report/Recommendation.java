package ca.gc.cra.soak.domain.report;

import ca.gc.cra.soak.domain.analysis.Severity;
import java.util.Objects;

/**
 * Operator recommendation derived from an issue category.
 *
 * @param category issue category; a report contains at most one entry per category
 * @param priority ordering key, most severe first
 * @param message guidance text
 * @since SOAK 0.1
 */
public record Recommendation(RecommendationCategory category, Severity priority, String message) {
  public Recommendation {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(priority, "priority");
    Objects.requireNonNull(message, "message");
  }
}
