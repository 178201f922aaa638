package ca.gc.cra.soak.domain.report;

import java.util.Objects;

/**
 * Overall session grade with its weighted sub-scores.
 *
 * @param score total in {@code [0, 100]}
 * @param letter letter derived from {@code score}
 * @param memoryScore memory stability share (max 30)
 * @param performanceScore performance share (max 25)
 * @param healthScore average health share (max 25)
 * @param alertScore alert share after penalties (max 20)
 * @since SOAK 0.1
 */
public record Grade(
    double score,
    GradeLetter letter,
    double memoryScore,
    double performanceScore,
    double healthScore,
    double alertScore) {

  public Grade {
    Objects.requireNonNull(letter, "letter");
    if (score < 0 || score > 100) {
      throw new IllegalArgumentException("score must be within [0, 100]");
    }
  }

  /**
   * Returns the fixed description of the letter.
   *
   * @return grade description
   */
  public String description() {
    return letter.description();
  }
}
