package ca.gc.cra.soak.domain.analysis;

import ca.gc.cra.soak.domain.session.NotificationKind;
import ca.gc.cra.soak.domain.session.SessionNotification;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable alert appended to the session alert log and fanned out to subscribers.
 *
 * @param id unique alert identifier
 * @param type alert category
 * @param severity graded severity
 * @param timestampMillis raise time in epoch milliseconds
 * @param details human readable summary
 * @param recommendations operator guidance, in the order produced
 * @param attributes structured context (leak count, unit id, score)
 * @since SOAK 0.1
 */
public record Alert(
    String id,
    AlertType type,
    Severity severity,
    long timestampMillis,
    String details,
    List<String> recommendations,
    Map<String, String> attributes) implements SessionNotification {

  public Alert {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(severity, "severity");
    details = details == null ? "" : details;
    recommendations = List.copyOf(Objects.requireNonNull(recommendations, "recommendations"));
    attributes = Map.copyOf(Objects.requireNonNull(attributes, "attributes"));
  }

  @Override
  public NotificationKind kind() {
    return NotificationKind.ALERT;
  }
}
