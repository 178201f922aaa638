package ca.gc.cra.soak.application.port;

import ca.gc.cra.soak.domain.metrics.MemorySample;
import ca.gc.cra.soak.domain.metrics.PerformanceSample;
import ca.gc.cra.soak.domain.metrics.StructuralCounts;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Capability that reads point-in-time resource figures from the observed process.
 * <p><strong>Why:</strong> Keeps the session core independent of any specific host; the same monitor runs
 * against JVM MXBeans, container cgroup statistics or a scripted fake.</p>
 * <p><strong>Contract:</strong> {@link #sampleMemory()} and {@link #sampleStructuralCounts()} are required
 * signals. The remaining probes are best effort: an empty result means "unknown", never "zero".</p>
 * <p><strong>Thread-safety:</strong> Implementations may be invoked from a probe thread distinct from the
 * scheduler thread and must tolerate that.</p>
 *
 * @since SOAK 0.1
 */
public interface MetricsProvider {

  /**
   * Reads the current memory usage.
   *
   * @return memory sample in bytes
   * @throws Exception when the host cannot be read; the caller treats the cycle as failed
   */
  MemorySample sampleMemory() throws Exception;

  /**
   * Reads structural counts such as live threads or loaded classes.
   *
   * @return structural counts for the observed process
   * @throws Exception when the host cannot be read
   */
  StructuralCounts sampleStructuralCounts() throws Exception;

  /**
   * Reads the latest rendering and response figures when the host exposes them.
   *
   * @return performance sample, or empty when not measurable
   */
  default Optional<PerformanceSample> samplePerformance() {
    return Optional.empty();
  }

  /**
   * Best-effort count of open handles (file descriptors, connections).
   *
   * @return handle count, or empty when the host gives no reliable answer
   */
  default OptionalLong probeOpenHandles() {
    return OptionalLong.empty();
  }
}
