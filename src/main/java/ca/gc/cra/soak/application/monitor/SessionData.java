package ca.gc.cra.soak.application.monitor;

import ca.gc.cra.soak.config.SessionConfig;
import ca.gc.cra.soak.domain.analysis.Alert;
import ca.gc.cra.soak.domain.analysis.HealthCheck;
import ca.gc.cra.soak.domain.analysis.LeakCandidate;
import ca.gc.cra.soak.domain.analysis.RemediationRecord;
import ca.gc.cra.soak.domain.metrics.Snapshot;
import ca.gc.cra.soak.domain.session.OperationEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Append-only record of everything observed during one session.
 * <p><strong>Role:</strong> Owned by {@link SessionOrchestrator}; mutated only from orchestrator callbacks
 * and read through {@link #view(long)} copies.</p>
 * <p><strong>Invariants:</strong> snapshots are appended in non-decreasing timestamp order; nothing is
 * appended after {@link #freeze(long)}. Appends after freezing are dropped and reported as {@code false}
 * so a stale timer can never extend a finalized session.</p>
 * <p><strong>Thread-safety:</strong> All methods synchronize on the instance.</p>
 *
 * @since SOAK 0.1
 */
public final class SessionData {
  private static final Logger log = LoggerFactory.getLogger(SessionData.class);

  private final String sessionId;
  private final long startedAtMillis;
  private final SessionConfig config;
  private final List<Snapshot> snapshots = new ArrayList<>();
  private final List<HealthCheck> healthChecks = new ArrayList<>();
  private final List<Alert> alerts = new ArrayList<>();
  private final List<LeakCandidate> leakCandidates = new ArrayList<>();
  private final List<OperationEvent> operations = new ArrayList<>();
  private final List<RemediationRecord> remediations = new ArrayList<>();
  private boolean frozen;
  private long endedAtMillis = -1L;

  /**
   * Creates empty session data.
   *
   * @param sessionId session identifier
   * @param startedAtMillis session start
   * @param config session configuration
   */
  public SessionData(String sessionId, long startedAtMillis, SessionConfig config) {
    this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    this.startedAtMillis = startedAtMillis;
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Appends a snapshot.
   *
   * @param snapshot snapshot strictly newer than the previous one
   * @return {@code false} when the data is frozen
   * @throws IllegalArgumentException when the snapshot is not newer than the last appended one
   */
  public synchronized boolean appendSnapshot(Snapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    if (rejectFrozen("snapshot")) {
      return false;
    }
    if (!snapshots.isEmpty()
        && snapshot.timestampMillis() <= snapshots.get(snapshots.size() - 1).timestampMillis()) {
      throw new IllegalArgumentException("snapshot timestamps must be strictly increasing");
    }
    snapshots.add(snapshot);
    return true;
  }

  public synchronized boolean appendHealthCheck(HealthCheck check) {
    Objects.requireNonNull(check, "check");
    if (rejectFrozen("health check")) {
      return false;
    }
    healthChecks.add(check);
    return true;
  }

  public synchronized boolean appendAlert(Alert alert) {
    Objects.requireNonNull(alert, "alert");
    if (rejectFrozen("alert")) {
      return false;
    }
    alerts.add(alert);
    return true;
  }

  public synchronized boolean appendLeakCandidates(List<LeakCandidate> candidates) {
    Objects.requireNonNull(candidates, "candidates");
    if (rejectFrozen("leak candidate")) {
      return false;
    }
    leakCandidates.addAll(candidates);
    return true;
  }

  public synchronized boolean appendOperation(OperationEvent event) {
    Objects.requireNonNull(event, "event");
    if (rejectFrozen("operation")) {
      return false;
    }
    operations.add(event);
    return true;
  }

  public synchronized boolean appendRemediation(RemediationRecord record) {
    Objects.requireNonNull(record, "record");
    if (rejectFrozen("remediation")) {
      return false;
    }
    remediations.add(record);
    return true;
  }

  /**
   * Finalizes the data. Subsequent appends are dropped. Idempotent.
   *
   * @param endedAtMillis finalization time
   */
  public synchronized void freeze(long endedAtMillis) {
    if (!frozen) {
      frozen = true;
      this.endedAtMillis = endedAtMillis;
    }
  }

  public synchronized boolean isFrozen() {
    return frozen;
  }

  public synchronized int snapshotCount() {
    return snapshots.size();
  }

  public synchronized int healthCheckCount() {
    return healthChecks.size();
  }

  public synchronized int alertCount() {
    return alerts.size();
  }

  public synchronized int leakCandidateCount() {
    return leakCandidates.size();
  }

  public synchronized int operationCount() {
    return operations.size();
  }

  public String sessionId() {
    return sessionId;
  }

  public long startedAtMillis() {
    return startedAtMillis;
  }

  public SessionConfig config() {
    return config;
  }

  /**
   * Copies the current contents.
   *
   * @param nowMillis end time reported for a session that is not frozen yet
   * @return immutable view
   */
  public synchronized SessionDataView view(long nowMillis) {
    long end = frozen ? endedAtMillis : nowMillis;
    return new SessionDataView(
        sessionId,
        startedAtMillis,
        end,
        config,
        snapshots,
        healthChecks,
        alerts,
        leakCandidates,
        operations,
        remediations,
        frozen);
  }

  private boolean rejectFrozen(String what) {
    if (frozen) {
      log.debug("Dropping {} for finalized session {}", what, sessionId);
      return true;
    }
    return false;
  }
}
