package ca.gc.cra.soak.domain.metrics;

/**
 * Point-in-time memory reading in bytes.
 *
 * @param usedBytes memory currently in use
 * @param totalBytes memory currently committed by the host
 * @param capacityBytes upper bound the host may grow to; {@code 0} when unknown
 * @since SOAK 0.1
 */
public record MemorySample(long usedBytes, long totalBytes, long capacityBytes) {
  /** Bytes per mebibyte, used for every MB figure the monitor reports. */
  public static final double BYTES_PER_MB = 1024d * 1024d;

  /**
   * Validates that no figure is negative.
   */
  public MemorySample {
    if (usedBytes < 0 || totalBytes < 0 || capacityBytes < 0) {
      throw new IllegalArgumentException("memory figures must be non-negative");
    }
  }

  /**
   * Convenience factory taking megabytes.
   *
   * @param usedMb used memory in MB
   * @param totalMb committed memory in MB
   * @param capacityMb capacity in MB
   * @return memory sample expressed in bytes
   */
  public static MemorySample ofMegabytes(double usedMb, double totalMb, double capacityMb) {
    return new MemorySample(
        Math.round(usedMb * BYTES_PER_MB),
        Math.round(totalMb * BYTES_PER_MB),
        Math.round(capacityMb * BYTES_PER_MB));
  }

  /**
   * Returns the used memory in MB.
   *
   * @return used megabytes
   */
  public double usedMb() {
    return usedBytes / BYTES_PER_MB;
  }

  /**
   * Returns utilization as a percentage of capacity, falling back to committed memory when the
   * capacity is unknown.
   *
   * @return utilization in {@code [0, 100]}, or {@code 0} when neither bound is known
   */
  public double utilizationPercent() {
    long bound = capacityBytes > 0 ? capacityBytes : totalBytes;
    if (bound <= 0) {
      return 0d;
    }
    return Math.min(100d, usedBytes * 100d / bound);
  }
}
