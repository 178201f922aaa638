package ca.gc.cra.soak.domain.session;

import java.util.Map;
import java.util.Objects;

/**
 * Interaction reported by the workload generator during a session.
 *
 * @param timestampMillis event time in epoch milliseconds
 * @param type operation type, e.g. {@code scroll} or {@code navigate}
 * @param attributes free-form details
 * @since SOAK 0.1
 */
public record OperationEvent(long timestampMillis, String type, Map<String, String> attributes) {
  public OperationEvent {
    Objects.requireNonNull(type, "type");
    if (type.isBlank()) {
      throw new IllegalArgumentException("type must not be blank");
    }
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }
}
