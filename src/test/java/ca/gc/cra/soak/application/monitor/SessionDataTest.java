package ca.gc.cra.soak.application.monitor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.soak.config.SessionConfig;
import ca.gc.cra.soak.domain.analysis.HealthCheck;
import ca.gc.cra.soak.domain.analysis.HealthStatus;
import ca.gc.cra.soak.domain.session.OperationEvent;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SessionDataTest {
  private final SessionData data = new SessionData("s-1", 1_000L, SessionConfig.defaults());

  @Test
  void viewIsDetachedFromLaterAppends() {
    data.appendSnapshot(Snapshots.of(1_000L, 100d));
    SessionDataView before = data.view(2_000L);

    data.appendSnapshot(Snapshots.of(2_000L, 110d));

    assertEquals(1, before.snapshots().size());
    assertEquals(2, data.view(3_000L).snapshots().size());
    assertThrows(UnsupportedOperationException.class, () -> before.snapshots().add(Snapshots.of(0L, 1d)));
  }

  @Test
  void frozenDataDropsAppends() {
    data.appendSnapshot(Snapshots.of(1_000L, 100d));
    data.freeze(5_000L);
    data.freeze(9_000L);

    assertFalse(data.appendSnapshot(Snapshots.of(6_000L, 100d)));
    assertFalse(data.appendHealthCheck(new HealthCheck(6_000L, 90d, HealthStatus.EXCELLENT, List.of())));
    assertFalse(data.appendOperation(new OperationEvent(6_000L, "open", Map.of())));
    assertFalse(data.appendLeakCandidates(List.of()));
    assertTrue(data.isFrozen());

    SessionDataView view = data.view(20_000L);
    assertEquals(1, view.snapshots().size());
    assertEquals(5_000L, view.endedAtMillis());
    assertEquals(4_000L, view.elapsedMillis());
    assertTrue(view.frozen());
  }

  @Test
  void snapshotsMustMoveForwardInTime() {
    data.appendSnapshot(Snapshots.of(2_000L, 100d));
    data.appendSnapshot(Snapshots.of(2_001L, 101d));

    assertThrows(IllegalArgumentException.class, () -> data.appendSnapshot(Snapshots.of(1_500L, 100d)));
    assertThrows(IllegalArgumentException.class, () -> data.appendSnapshot(Snapshots.of(2_001L, 102d)));
    assertEquals(2, data.snapshotCount());
  }

  @Test
  void viewExposesBaselineAndLatest() {
    SessionDataView empty = data.view(1_000L);
    assertTrue(empty.baseline().isEmpty());
    assertTrue(empty.latestHealthCheck().isEmpty());

    data.appendSnapshot(Snapshots.of(1_000L, 100d));
    data.appendSnapshot(Snapshots.of(2_000L, 120d));
    data.appendHealthCheck(new HealthCheck(2_000L, 70d, HealthStatus.FAIR, List.of("slow")));

    SessionDataView view = data.view(2_500L);
    assertEquals(100d, view.baseline().orElseThrow().usedMb(), 1e-9);
    assertEquals(120d, view.latestSnapshot().orElseThrow().usedMb(), 1e-9);
    assertEquals(70d, view.latestHealthCheck().orElseThrow().score());
    assertEquals(1_500L, view.elapsedMillis());
    assertFalse(view.frozen());
  }
}
