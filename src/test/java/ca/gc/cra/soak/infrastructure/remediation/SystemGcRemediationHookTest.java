package ca.gc.cra.soak.infrastructure.remediation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.soak.domain.analysis.Alert;
import ca.gc.cra.soak.domain.analysis.AlertType;
import ca.gc.cra.soak.domain.analysis.RemediationOutcome;
import ca.gc.cra.soak.domain.analysis.Severity;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import javax.management.ObjectName;
import org.junit.jupiter.api.Test;

class SystemGcRemediationHookTest {
  private static final Alert ALERT =
      new Alert("s-1-alert-1", AlertType.MEMORY_LEAK, Severity.HIGH, 0L, "", List.of(), Map.of());

  @Test
  void reportsHeapReclaimedByCollection() {
    ScriptedMemory memory = new ScriptedMemory(900L, 600L);
    int[] collections = {0};
    SystemGcRemediationHook hook = new SystemGcRemediationHook(memory, () -> collections[0]++);

    RemediationOutcome outcome = hook.remediate(ALERT);

    assertTrue(outcome.success());
    assertEquals(300L, outcome.reclaimedBytes());
    assertEquals(1, collections[0]);
  }

  @Test
  void growthDuringCollectionReportsZero() {
    SystemGcRemediationHook hook = new SystemGcRemediationHook(new ScriptedMemory(500L, 700L), () -> {});

    assertEquals(0L, hook.remediate(ALERT).reclaimedBytes());
  }

  private static final class ScriptedMemory implements MemoryMXBean {
    private final Deque<Long> used = new ArrayDeque<>();

    private ScriptedMemory(long... values) {
      for (long value : values) {
        used.add(value);
      }
    }

    @Override
    public int getObjectPendingFinalizationCount() {
      return 0;
    }

    @Override
    public MemoryUsage getHeapMemoryUsage() {
      return new MemoryUsage(0L, used.poll(), 1_000L, 1_000L);
    }

    @Override
    public MemoryUsage getNonHeapMemoryUsage() {
      return new MemoryUsage(0L, 0L, 0L, -1L);
    }

    @Override
    public boolean isVerbose() {
      return false;
    }

    @Override
    public void setVerbose(boolean value) {}

    @Override
    public void gc() {}

    @Override
    public ObjectName getObjectName() {
      return null;
    }
  }
}
