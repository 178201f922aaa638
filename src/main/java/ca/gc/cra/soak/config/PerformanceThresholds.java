package ca.gc.cra.soak.config;

/**
 * Performance targets used by health scoring and grading.
 *
 * @param minFrameRate target frame rate in frames per second
 * @param maxResponseTimeMillis acceptable mean response time
 * @since SOAK 0.1
 */
public record PerformanceThresholds(double minFrameRate, double maxResponseTimeMillis) {

  public static PerformanceThresholds defaults() {
    return new PerformanceThresholds(55d, 100d);
  }

  void validate() {
    if (!(minFrameRate > 0) || !(maxResponseTimeMillis > 0)) {
      throw new ConfigurationException("performance thresholds must be positive");
    }
  }
}
