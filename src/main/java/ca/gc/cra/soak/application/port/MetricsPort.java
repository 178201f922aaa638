package ca.gc.cra.soak.application.port;

/**
 * Port for emitting counters and observations about the monitor's own behaviour.
 *
 * @since SOAK 0.1
 */
public interface MetricsPort {
  /**
   * Increments a counter identified by {@code key}.
   *
   * @param key dotted metric name, e.g. {@code soak.snapshot.taken}
   */
  void increment(String key);

  /**
   * Records a numeric observation for {@code key}.
   *
   * @param key dotted metric name
   * @param value observed value in the unit implied by the key
   */
  void observe(String key, long value);

  /** Metrics port that discards every signal. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override
    public void increment(String key) {}

    @Override
    public void observe(String key, long value) {}
  };
}
