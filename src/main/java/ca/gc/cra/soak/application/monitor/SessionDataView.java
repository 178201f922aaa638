package ca.gc.cra.soak.application.monitor;

import ca.gc.cra.soak.config.SessionConfig;
import ca.gc.cra.soak.domain.analysis.Alert;
import ca.gc.cra.soak.domain.analysis.HealthCheck;
import ca.gc.cra.soak.domain.analysis.LeakCandidate;
import ca.gc.cra.soak.domain.analysis.RemediationRecord;
import ca.gc.cra.soak.domain.metrics.Snapshot;
import ca.gc.cra.soak.domain.session.OperationEvent;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable copy of {@link SessionData} handed to scorers, report generation and status projections.
 *
 * @param sessionId session identifier
 * @param startedAtMillis session start
 * @param endedAtMillis freeze time, or the copy time while the session is still live
 * @param config session configuration
 * @param snapshots snapshots in timestamp order, baseline first
 * @param healthChecks health checks in evaluation order
 * @param alerts alerts in detection order
 * @param leakCandidates leak candidates in detection order
 * @param operations workload operations in arrival order
 * @param remediations remediation attempts in invocation order
 * @param frozen {@code true} once the session was finalized
 * @since SOAK 0.1
 */
public record SessionDataView(
    String sessionId,
    long startedAtMillis,
    long endedAtMillis,
    SessionConfig config,
    List<Snapshot> snapshots,
    List<HealthCheck> healthChecks,
    List<Alert> alerts,
    List<LeakCandidate> leakCandidates,
    List<OperationEvent> operations,
    List<RemediationRecord> remediations,
    boolean frozen) {

  public SessionDataView {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(config, "config");
    snapshots = List.copyOf(snapshots);
    healthChecks = List.copyOf(healthChecks);
    alerts = List.copyOf(alerts);
    leakCandidates = List.copyOf(leakCandidates);
    operations = List.copyOf(operations);
    remediations = List.copyOf(remediations);
  }

  /**
   * Returns the baseline snapshot.
   *
   * @return first snapshot, or empty when none was recorded
   */
  public Optional<Snapshot> baseline() {
    return snapshots.isEmpty() ? Optional.empty() : Optional.of(snapshots.get(0));
  }

  /**
   * Returns the most recent snapshot.
   *
   * @return last snapshot, or empty when none was recorded
   */
  public Optional<Snapshot> latestSnapshot() {
    return snapshots.isEmpty() ? Optional.empty() : Optional.of(snapshots.get(snapshots.size() - 1));
  }

  /**
   * Returns the most recent health check.
   *
   * @return last health check, or empty when none was recorded
   */
  public Optional<HealthCheck> latestHealthCheck() {
    return healthChecks.isEmpty()
        ? Optional.empty()
        : Optional.of(healthChecks.get(healthChecks.size() - 1));
  }

  public long elapsedMillis() {
    return Math.max(0L, endedAtMillis - startedAtMillis);
  }
}
