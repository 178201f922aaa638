package ca.gc.cra.soak.domain.report;

/**
 * Letter grades with their fixed cutoffs and descriptions.
 *
 * @since SOAK 0.1
 */
public enum GradeLetter {
  A(90, "Excellent - system is highly stable for extended sessions"),
  B(80, "Good - minor issues that should be monitored"),
  C(70, "Fair - several issues need attention"),
  D(60, "Poor - significant stability issues detected"),
  F(0, "Failing - critical issues prevent extended session use");

  private final double minimumScore;
  private final String description;

  GradeLetter(double minimumScore, String description) {
    this.minimumScore = minimumScore;
    this.description = description;
  }

  /**
   * Maps a score onto a letter.
   *
   * @param score overall score in {@code [0, 100]}
   * @return first letter whose cutoff the score reaches
   */
  public static GradeLetter fromScore(double score) {
    for (GradeLetter letter : values()) {
      if (score >= letter.minimumScore) {
        return letter;
      }
    }
    return F;
  }

  public double minimumScore() {
    return minimumScore;
  }

  public String description() {
    return description;
  }
}
