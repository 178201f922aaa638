package ca.gc.cra.soak.application.monitor;

import ca.gc.cra.soak.domain.report.FinalReport;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of {@code stop()}: either the final report of the session that was just finalized, or a
 * "no active session" marker.
 *
 * @param outcome stop outcome
 * @param report final report when {@code outcome} is {@link Outcome#COMPLETED}
 * @since SOAK 0.1
 */
public record StopResult(Outcome outcome, Optional<FinalReport> report) {

  /** Stop outcomes. */
  public enum Outcome {
    COMPLETED,
    NO_ACTIVE_SESSION
  }

  public StopResult {
    Objects.requireNonNull(outcome, "outcome");
    Objects.requireNonNull(report, "report");
    if (outcome == Outcome.COMPLETED && report.isEmpty()) {
      throw new IllegalArgumentException("completed stop requires a report");
    }
  }

  public static StopResult completed(FinalReport report) {
    return new StopResult(Outcome.COMPLETED, Optional.of(report));
  }

  public static StopResult noActiveSession() {
    return new StopResult(Outcome.NO_ACTIVE_SESSION, Optional.empty());
  }

  public boolean isCompleted() {
    return outcome == Outcome.COMPLETED;
  }
}
