package ca.gc.cra.soak.application.monitor;

import ca.gc.cra.soak.domain.analysis.Alert;
import ca.gc.cra.soak.domain.analysis.AlertType;
import ca.gc.cra.soak.domain.analysis.HealthCheck;
import ca.gc.cra.soak.domain.analysis.LeakCandidate;
import ca.gc.cra.soak.domain.analysis.Severity;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds alerts for one session with sequential ids ({@code <sessionId>-alert-<n>}).
 */
final class AlertFactory {
  private final String sessionId;
  private final AtomicLong sequence = new AtomicLong();

  AlertFactory(String sessionId) {
    this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
  }

  Alert leakCycle(List<LeakCandidate> candidates, long timestampMillis) {
    if (candidates.isEmpty()) {
      throw new IllegalArgumentException("candidates must not be empty");
    }
    Severity severity = LeakAnalysisEngine.overallSeverity(candidates);
    List<String> types = new ArrayList<>();
    Set<String> recommendations = new LinkedHashSet<>();
    for (LeakCandidate candidate : candidates) {
      types.add(candidate.type().name().toLowerCase(Locale.ROOT) + "(" + candidate.severity() + ")");
      if (!candidate.recommendation().isEmpty()) {
        recommendations.add(candidate.recommendation());
      }
    }
    return new Alert(
        nextId(),
        AlertType.MEMORY_LEAK,
        severity,
        timestampMillis,
        candidates.size() + " potential memory leak(s) detected: " + String.join(", ", types),
        List.copyOf(recommendations),
        Map.of("leakCount", Integer.toString(candidates.size())));
  }

  Alert component(LeakCandidate candidate, long timestampMillis) {
    String unitId = candidate.metrics().getOrDefault("unitId", "unknown");
    String phase = LeakCandidate.CLEANUP_TAG.equals(candidate.tag()) ? "after removal" : "while active";
    return new Alert(
        nextId(),
        AlertType.COMPONENT_LEAK,
        candidate.severity(),
        timestampMillis,
        "Unit " + unitId + " leaked " + candidate.metrics().getOrDefault("deltaMb", "?") + "MB " + phase,
        candidate.recommendation().isEmpty() ? List.of() : List.of(candidate.recommendation()),
        Map.of("unitId", unitId, "tag", candidate.tag()));
  }

  Alert healthDegraded(HealthCheck check, double minScore) {
    Severity severity = check.score() < 40d ? Severity.CRITICAL : Severity.HIGH;
    return new Alert(
        nextId(),
        AlertType.HEALTH_DEGRADED,
        severity,
        check.timestampMillis(),
        String.format(Locale.ROOT, "Health score %.1f fell below %.1f (%s)",
            check.score(), minScore, check.status()),
        check.issues(),
        Map.of("score", Double.toString(check.score())));
  }

  private String nextId() {
    return sessionId + "-alert-" + sequence.incrementAndGet();
  }
}
