package ca.gc.cra.soak.domain.session;

import java.util.Objects;

/**
 * Read-only projection returned by {@code getStatus()}; never references live session data.
 *
 * @param sessionId active or last session id; empty when no session has run
 * @param status lifecycle state
 * @param elapsedMillis time since start
 * @param remainingMillis time until the configured duration elapses
 * @param progressPercent elapsed share of the configured duration
 * @param snapshotCount recorded snapshots
 * @param healthCheckCount recorded health checks
 * @param alertCount recorded alerts
 * @param leakCandidateCount recorded leak candidates
 * @param operationCount recorded operation events
 * @param trackedUnitCount units currently tracked
 * @since SOAK 0.1
 */
public record SessionStatusView(
    String sessionId,
    SessionStatus status,
    long elapsedMillis,
    long remainingMillis,
    double progressPercent,
    int snapshotCount,
    int healthCheckCount,
    int alertCount,
    int leakCandidateCount,
    int operationCount,
    int trackedUnitCount) {

  public SessionStatusView {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(status, "status");
  }

  /**
   * Status reported before any session has started.
   *
   * @return idle view with zero counts
   */
  public static SessionStatusView idle() {
    return new SessionStatusView("", SessionStatus.IDLE, 0L, 0L, 0d, 0, 0, 0, 0, 0, 0);
  }

  /**
   * Reports whether a session is currently running.
   *
   * @return {@code true} when {@link #status()} is {@link SessionStatus#RUNNING}
   */
  public boolean running() {
    return status == SessionStatus.RUNNING;
  }
}
