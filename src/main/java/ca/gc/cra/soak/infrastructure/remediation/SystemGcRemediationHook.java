package ca.gc.cra.soak.infrastructure.remediation;

import ca.gc.cra.soak.application.port.RemediationHook;
import ca.gc.cra.soak.domain.analysis.Alert;
import ca.gc.cra.soak.domain.analysis.RemediationOutcome;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remediation hook that requests a full garbage collection and reports the heap reclaimed.
 *
 * <p>{@link System#gc()} is only a hint; a JVM started with {@code -XX:+DisableExplicitGC} reclaims
 * nothing and the outcome reports zero bytes.</p>
 *
 * @since SOAK 0.1
 */
public final class SystemGcRemediationHook implements RemediationHook {
  private static final Logger log = LoggerFactory.getLogger(SystemGcRemediationHook.class);

  private final MemoryMXBean memory;
  private final Runnable collector;

  public SystemGcRemediationHook() {
    this(ManagementFactory.getMemoryMXBean(), System::gc);
  }

  SystemGcRemediationHook(MemoryMXBean memory, Runnable collector) {
    this.memory = Objects.requireNonNull(memory, "memory");
    this.collector = Objects.requireNonNull(collector, "collector");
  }

  @Override
  public RemediationOutcome remediate(Alert alert) {
    long before = memory.getHeapMemoryUsage().getUsed();
    collector.run();
    long after = memory.getHeapMemoryUsage().getUsed();
    long reclaimed = Math.max(0L, before - after);
    log.info("Requested GC for alert {}: reclaimed {} bytes", alert.id(), reclaimed);
    return new RemediationOutcome(true, reclaimed, "garbage collection requested");
  }
}
