package ca.gc.cra.soak.domain.analysis;

import ca.gc.cra.soak.domain.session.NotificationKind;
import ca.gc.cra.soak.domain.session.SessionNotification;
import java.util.List;
import java.util.Objects;

/**
 * Composite health evaluation of a session at one point in time.
 *
 * @param timestampMillis evaluation time
 * @param score health score in {@code [0, 100]}
 * @param status banded status for {@code score}
 * @param issues findings that reduced the score
 * @since SOAK 0.1
 */
public record HealthCheck(long timestampMillis, double score, HealthStatus status, List<String> issues)
    implements SessionNotification {

  public HealthCheck {
    if (score < 0 || score > 100 || Double.isNaN(score)) {
      throw new IllegalArgumentException("score must be within [0, 100]");
    }
    Objects.requireNonNull(status, "status");
    issues = List.copyOf(Objects.requireNonNull(issues, "issues"));
  }

  @Override
  public NotificationKind kind() {
    return NotificationKind.HEALTH_CHECK;
  }
}
