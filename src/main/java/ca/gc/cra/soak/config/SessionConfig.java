package ca.gc.cra.soak.config;

import ca.gc.cra.soak.validation.Numbers;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable settings for one monitoring session.
 * <p><strong>Why:</strong> Collects cadences, leak thresholds, performance targets and feature switches in a
 * single validated value handed to the session orchestrator.</p>
 * <p><strong>Role:</strong> Configuration record built from flattened key/value maps (YAML, overrides,
 * defaults) via {@link #fromMap(Map)}.</p>
 * <p><strong>Validation:</strong> {@link #validate()} rejects non-positive durations and intervals,
 * unordered thresholds and out-of-range ratios with {@link ConfigurationException}. The orchestrator
 * validates again on {@code start}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param sessionDuration hard cap on session length
 * @param snapshotInterval snapshot cadence
 * @param healthCheckInterval health-check cadence
 * @param reportingInterval progress-report cadence
 * @param componentCheckInterval per-unit re-measurement cadence
 * @param snapshotTimeout upper bound on a single metrics read
 * @param enableLeakDetection run leak analysis on every snapshot and component measurement
 * @param enableAutomaticRemediation invoke the remediation hook for HIGH and CRITICAL alerts
 * @param verbose raise logging to DEBUG when the session is wired
 * @param leak snapshot-series leak thresholds
 * @param component tracked-unit size bands
 * @param performance performance targets
 * @param health health scoring constants
 * @param incompleteDataRatio observed/expected ratio below which the report flags incomplete data
 * @since SOAK 0.1
 */
public record SessionConfig(
    Duration sessionDuration,
    Duration snapshotInterval,
    Duration healthCheckInterval,
    Duration reportingInterval,
    Duration componentCheckInterval,
    Duration snapshotTimeout,
    boolean enableLeakDetection,
    boolean enableAutomaticRemediation,
    boolean verbose,
    LeakThresholds leak,
    ComponentThresholds component,
    PerformanceThresholds performance,
    HealthSettings health,
    double incompleteDataRatio) {

  public SessionConfig {
    Objects.requireNonNull(sessionDuration, "sessionDuration");
    Objects.requireNonNull(snapshotInterval, "snapshotInterval");
    Objects.requireNonNull(healthCheckInterval, "healthCheckInterval");
    Objects.requireNonNull(reportingInterval, "reportingInterval");
    Objects.requireNonNull(componentCheckInterval, "componentCheckInterval");
    Objects.requireNonNull(snapshotTimeout, "snapshotTimeout");
    Objects.requireNonNull(leak, "leak");
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(performance, "performance");
    Objects.requireNonNull(health, "health");
  }

  /**
   * Returns the default eight-hour session configuration.
   *
   * @return defaults with leak detection on and automatic remediation off
   */
  public static SessionConfig defaults() {
    return new SessionConfig(
        Duration.ofHours(8),
        Duration.ofMinutes(1),
        Duration.ofMinutes(5),
        Duration.ofMinutes(30),
        Duration.ofSeconds(30),
        Duration.ofSeconds(5),
        true,
        false,
        false,
        LeakThresholds.defaults(),
        ComponentThresholds.defaults(),
        PerformanceThresholds.defaults(),
        HealthSettings.defaults(),
        0.8d);
  }

  /**
   * Builds a configuration from flattened keys, falling back to {@link #defaults()} for missing ones.
   *
   * <p>Durations accept ISO-8601 ({@code PT8H}) or plain milliseconds.</p>
   *
   * @param args flattened configuration map
   * @return validated configuration
   * @throws ConfigurationException when a value cannot be parsed or fails validation
   */
  public static SessionConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    SessionConfig d = defaults();
    LeakThresholds leak = new LeakThresholds(
        decimal(args, "leak.maxMemoryGrowthMb", d.leak().maxMemoryGrowthMb()),
        integer(args, "leak.structuralGrowthThreshold", d.leak().structuralGrowthThreshold()),
        integer(args, "leak.structuralGrowthHighThreshold", d.leak().structuralGrowthHighThreshold()),
        (int) ranged(args, "leak.trendWindow", d.leak().trendWindow(), 3, 1_000),
        ratio(args, "leak.trendMinConfidence", d.leak().trendMinConfidence()));
    ComponentThresholds component = new ComponentThresholds(
        decimal(args, "leak.component.lowMb", d.component().lowMb()),
        decimal(args, "leak.component.mediumMb", d.component().mediumMb()),
        decimal(args, "leak.component.highMb", d.component().highMb()),
        decimal(args, "leak.component.criticalMb", d.component().criticalMb()),
        decimal(args, "leak.component.perCycleGrowthMb", d.component().perCycleGrowthMb()));
    PerformanceThresholds performance = new PerformanceThresholds(
        decimal(args, "performance.minFrameRate", d.performance().minFrameRate()),
        decimal(args, "performance.maxResponseTimeMs", d.performance().maxResponseTimeMillis()));
    HealthSettings health = new HealthSettings(
        decimal(args, "health.minScore", d.health().minScore()),
        duration(args, "health.alertWindow", d.health().alertWindow()),
        decimal(args, "health.criticalAlertPenalty", d.health().criticalAlertPenalty()),
        decimal(args, "health.highAlertPenalty", d.health().highAlertPenalty()));

    SessionConfig config = new SessionConfig(
        duration(args, "sessionDuration", d.sessionDuration()),
        duration(args, "snapshotInterval", d.snapshotInterval()),
        duration(args, "healthCheckInterval", d.healthCheckInterval()),
        duration(args, "reportingInterval", d.reportingInterval()),
        duration(args, "componentCheckInterval", d.componentCheckInterval()),
        duration(args, "snapshotTimeout", d.snapshotTimeout()),
        bool(args, "enableLeakDetection", d.enableLeakDetection()),
        bool(args, "enableAutomaticRemediation", d.enableAutomaticRemediation()),
        bool(args, "verbose", d.verbose()),
        leak,
        component,
        performance,
        health,
        ratio(args, "report.incompleteDataRatio", d.incompleteDataRatio()));
    config.validate();
    return config;
  }

  /**
   * Checks every invariant of this configuration.
   *
   * @return this configuration for fluent use
   * @throws ConfigurationException when any invariant fails
   */
  public SessionConfig validate() {
    requirePositive("sessionDuration", sessionDuration);
    requirePositive("snapshotInterval", snapshotInterval);
    requirePositive("healthCheckInterval", healthCheckInterval);
    requirePositive("reportingInterval", reportingInterval);
    requirePositive("componentCheckInterval", componentCheckInterval);
    requirePositive("snapshotTimeout", snapshotTimeout);
    if (incompleteDataRatio <= 0 || incompleteDataRatio > 1) {
      throw new ConfigurationException("report.incompleteDataRatio must be within (0, 1]");
    }
    leak.validate();
    component.validate();
    performance.validate();
    health.validate();
    return this;
  }

  /**
   * Flattens this configuration back into the keys understood by {@link #fromMap(Map)}.
   *
   * @return ordered flat map
   */
  public Map<String, String> toFlatMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("sessionDuration", sessionDuration.toString());
    map.put("snapshotInterval", snapshotInterval.toString());
    map.put("healthCheckInterval", healthCheckInterval.toString());
    map.put("reportingInterval", reportingInterval.toString());
    map.put("componentCheckInterval", componentCheckInterval.toString());
    map.put("snapshotTimeout", snapshotTimeout.toString());
    map.put("enableLeakDetection", Boolean.toString(enableLeakDetection));
    map.put("enableAutomaticRemediation", Boolean.toString(enableAutomaticRemediation));
    map.put("verbose", Boolean.toString(verbose));
    map.put("leak.maxMemoryGrowthMb", Double.toString(leak.maxMemoryGrowthMb()));
    map.put("leak.structuralGrowthThreshold", Long.toString(leak.structuralGrowthThreshold()));
    map.put("leak.structuralGrowthHighThreshold", Long.toString(leak.structuralGrowthHighThreshold()));
    map.put("leak.trendWindow", Integer.toString(leak.trendWindow()));
    map.put("leak.trendMinConfidence", Double.toString(leak.trendMinConfidence()));
    map.put("leak.component.lowMb", Double.toString(component.lowMb()));
    map.put("leak.component.mediumMb", Double.toString(component.mediumMb()));
    map.put("leak.component.highMb", Double.toString(component.highMb()));
    map.put("leak.component.criticalMb", Double.toString(component.criticalMb()));
    map.put("leak.component.perCycleGrowthMb", Double.toString(component.perCycleGrowthMb()));
    map.put("performance.minFrameRate", Double.toString(performance.minFrameRate()));
    map.put("performance.maxResponseTimeMs", Double.toString(performance.maxResponseTimeMillis()));
    map.put("health.minScore", Double.toString(health.minScore()));
    map.put("health.alertWindow", health.alertWindow().toString());
    map.put("health.criticalAlertPenalty", Double.toString(health.criticalAlertPenalty()));
    map.put("health.highAlertPenalty", Double.toString(health.highAlertPenalty()));
    map.put("report.incompleteDataRatio", Double.toString(incompleteDataRatio));
    return map;
  }

  /**
   * Returns a copy with a different session duration.
   *
   * @param duration new duration
   * @return updated configuration (not validated)
   */
  public SessionConfig withSessionDuration(Duration duration) {
    return new SessionConfig(
        duration, snapshotInterval, healthCheckInterval, reportingInterval, componentCheckInterval,
        snapshotTimeout, enableLeakDetection, enableAutomaticRemediation, verbose, leak, component,
        performance, health, incompleteDataRatio);
  }

  /**
   * Returns a copy with different leak thresholds.
   *
   * @param thresholds new thresholds
   * @return updated configuration (not validated)
   */
  public SessionConfig withLeakThresholds(LeakThresholds thresholds) {
    return new SessionConfig(
        sessionDuration, snapshotInterval, healthCheckInterval, reportingInterval,
        componentCheckInterval, snapshotTimeout, enableLeakDetection, enableAutomaticRemediation,
        verbose, thresholds, component, performance, health, incompleteDataRatio);
  }

  private static void requirePositive(String key, Duration value) {
    try {
      Numbers.requirePositive(key, value);
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException(ex.getMessage(), ex);
    }
  }

  private static Duration duration(Map<String, String> args, String key, Duration fallback) {
    String raw = trimmed(args.get(key));
    if (raw.isEmpty()) {
      return fallback;
    }
    try {
      if (raw.chars().allMatch(c -> Character.isDigit(c) || c == '-')) {
        return Duration.ofMillis(Long.parseLong(raw));
      }
      return Duration.parse(raw.toUpperCase(Locale.ROOT));
    } catch (NumberFormatException | DateTimeParseException ex) {
      throw new ConfigurationException(key + " must be an ISO-8601 duration or milliseconds: " + raw, ex);
    }
  }

  private static double decimal(Map<String, String> args, String key, double fallback) {
    String raw = trimmed(args.get(key));
    if (raw.isEmpty()) {
      return fallback;
    }
    try {
      double value = Double.parseDouble(raw);
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        throw new ConfigurationException(key + " must be finite: " + raw);
      }
      return value;
    } catch (NumberFormatException ex) {
      throw new ConfigurationException(key + " must be numeric: " + raw, ex);
    }
  }

  private static long integer(Map<String, String> args, String key, long fallback) {
    String raw = trimmed(args.get(key));
    if (raw.isEmpty()) {
      return fallback;
    }
    try {
      return Long.parseLong(raw);
    } catch (NumberFormatException ex) {
      throw new ConfigurationException(key + " must be an integer: " + raw, ex);
    }
  }

  private static long ranged(Map<String, String> args, String key, long fallback, long min, long max) {
    long value = integer(args, key, fallback);
    try {
      return Numbers.requireRange(key, value, min, max);
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException(ex.getMessage(), ex);
    }
  }

  private static double ratio(Map<String, String> args, String key, double fallback) {
    double value = decimal(args, key, fallback);
    try {
      return Numbers.requireRatio(key, value);
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException(ex.getMessage(), ex);
    }
  }

  private static boolean bool(Map<String, String> args, String key, boolean fallback) {
    String raw = trimmed(args.get(key)).toLowerCase(Locale.ROOT);
    return switch (raw) {
      case "" -> fallback;
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new ConfigurationException(key + " must be true or false: " + raw);
    };
  }

  private static String trimmed(String value) {
    return value == null ? "" : value.trim();
  }
}
