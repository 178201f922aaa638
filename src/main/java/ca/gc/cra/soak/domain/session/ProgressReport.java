package ca.gc.cra.soak.domain.session;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Periodic progress payload published to {@link NotificationKind#PROGRESS} subscribers.
 *
 * @param sessionId session identifier
 * @param timestampMillis report time
 * @param elapsedMillis time since the session started
 * @param remainingMillis time until the configured duration elapses
 * @param progressPercent elapsed share of the configured duration in {@code [0, 100]}
 * @param currentMemoryMb latest used memory, when a snapshot exists
 * @param latestHealthScore latest health score, when a check exists
 * @param snapshotCount snapshots recorded so far
 * @param alertCount alerts raised so far
 * @param leakCandidateCount leak candidates detected so far
 * @param trackedUnitCount units currently tracked
 * @since SOAK 0.1
 */
public record ProgressReport(
    String sessionId,
    long timestampMillis,
    long elapsedMillis,
    long remainingMillis,
    double progressPercent,
    OptionalDouble currentMemoryMb,
    OptionalDouble latestHealthScore,
    int snapshotCount,
    int alertCount,
    int leakCandidateCount,
    int trackedUnitCount) implements SessionNotification {

  public ProgressReport {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(currentMemoryMb, "currentMemoryMb");
    Objects.requireNonNull(latestHealthScore, "latestHealthScore");
  }

  @Override
  public NotificationKind kind() {
    return NotificationKind.PROGRESS;
  }
}
