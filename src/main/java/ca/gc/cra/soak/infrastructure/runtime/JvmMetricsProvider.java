package ca.gc.cra.soak.infrastructure.runtime;

import ca.gc.cra.soak.application.port.MetricsProvider;
import ca.gc.cra.soak.domain.metrics.MemorySample;
import ca.gc.cra.soak.domain.metrics.StructuralCounts;
import java.lang.management.ClassLoadingMXBean;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.ThreadMXBean;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> {@link MetricsProvider} for the JVM the monitor runs in.
 * <p><strong>Memory:</strong> heap usage from {@link MemoryMXBean}; {@code totalBytes} is the committed heap
 * and {@code capacityBytes} the maximum heap, or {@code 0} when the JVM reports none.</p>
 * <p><strong>Structure:</strong> live threads plus loaded classes, broken down as {@code threads} and
 * {@code classes}.</p>
 * <p><strong>Handles:</strong> open file descriptors on Unix-like hosts; empty elsewhere.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from MXBean references; safe for concurrent reads.</p>
 *
 * @since SOAK 0.1
 */
public final class JvmMetricsProvider implements MetricsProvider {
  private final MemoryMXBean memory;
  private final ThreadMXBean threads;
  private final ClassLoadingMXBean classes;
  private final OperatingSystemMXBean os;

  public JvmMetricsProvider() {
    this(
        ManagementFactory.getMemoryMXBean(),
        ManagementFactory.getThreadMXBean(),
        ManagementFactory.getClassLoadingMXBean(),
        ManagementFactory.getOperatingSystemMXBean());
  }

  JvmMetricsProvider(
      MemoryMXBean memory, ThreadMXBean threads, ClassLoadingMXBean classes, OperatingSystemMXBean os) {
    this.memory = memory;
    this.threads = threads;
    this.classes = classes;
    this.os = os;
  }

  @Override
  public MemorySample sampleMemory() {
    MemoryUsage heap = memory.getHeapMemoryUsage();
    long max = heap.getMax();
    return new MemorySample(heap.getUsed(), heap.getCommitted(), max < 0 ? 0L : max);
  }

  @Override
  public StructuralCounts sampleStructuralCounts() {
    long threadCount = threads.getThreadCount();
    long classCount = classes.getLoadedClassCount();
    Map<String, Long> breakdown = new LinkedHashMap<>();
    breakdown.put("threads", threadCount);
    breakdown.put("classes", classCount);
    return new StructuralCounts(threadCount + classCount, breakdown);
  }

  @Override
  public OptionalLong probeOpenHandles() {
    if (os instanceof com.sun.management.UnixOperatingSystemMXBean unix) {
      long open = unix.getOpenFileDescriptorCount();
      return open < 0 ? OptionalLong.empty() : OptionalLong.of(open);
    }
    return OptionalLong.empty();
  }
}
