package ca.gc.cra.soak.domain.metrics;

/**
 * Rendering and responsiveness figures for the observed process.
 *
 * @param frameRate frames per second
 * @param responseTimeMillis mean interaction response time in milliseconds
 * @since SOAK 0.1
 */
public record PerformanceSample(double frameRate, double responseTimeMillis) {
  public PerformanceSample {
    if (frameRate < 0 || responseTimeMillis < 0) {
      throw new IllegalArgumentException("performance figures must be non-negative");
    }
  }
}
