package ca.gc.cra.soak.application.monitor;

import java.util.Objects;
import java.util.Optional;

/**
 * Enforces at most one active session among the orchestrators that share this instance.
 *
 * <p>Passed explicitly to each orchestrator; there is no static or global registry.</p>
 *
 * @since SOAK 0.1
 */
public final class SessionRegistry {
  private String activeSessionId;

  /**
   * Claims the active slot.
   *
   * @param sessionId session about to start
   * @throws AlreadyRunningException when another session holds the slot
   */
  public synchronized void acquire(String sessionId) {
    Objects.requireNonNull(sessionId, "sessionId");
    if (activeSessionId != null) {
      throw new AlreadyRunningException("session " + activeSessionId + " is already active");
    }
    activeSessionId = sessionId;
  }

  /**
   * Releases the slot when held by {@code sessionId}.
   *
   * @param sessionId session that finished
   * @return {@code true} when the slot was released
   */
  public synchronized boolean release(String sessionId) {
    if (sessionId != null && sessionId.equals(activeSessionId)) {
      activeSessionId = null;
      return true;
    }
    return false;
  }

  public synchronized Optional<String> activeSession() {
    return Optional.ofNullable(activeSessionId);
  }
}
