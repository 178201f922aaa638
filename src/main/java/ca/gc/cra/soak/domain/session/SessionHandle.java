package ca.gc.cra.soak.domain.session;

import java.time.Duration;
import java.util.Objects;

/**
 * Identifies a started session.
 *
 * @param sessionId unique session identifier
 * @param startedAtMillis start time in epoch milliseconds
 * @param duration configured hard cap on session length
 * @since SOAK 0.1
 */
public record SessionHandle(String sessionId, long startedAtMillis, Duration duration) {
  public SessionHandle {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(duration, "duration");
  }

  /**
   * Returns the time at which the session will be stopped automatically.
   *
   * @return deadline in epoch milliseconds
   */
  public long deadlineMillis() {
    return startedAtMillis + duration.toMillis();
  }
}
