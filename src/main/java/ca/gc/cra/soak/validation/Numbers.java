package ca.gc.cra.soak.validation;

import java.time.Duration;
import java.util.Objects;

/**
 * <strong>What:</strong> Argument checks shared by configuration parsing and threshold records.
 * <p><strong>Why:</strong> Session cadences, severity bands and ratios are validated once, before any
 * task is scheduled, with messages that name the configuration key.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 * <p><strong>Observability:</strong> None; failures surface as {@link IllegalArgumentException}.</p>
 *
 * @since SOAK 0.1
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Checks that {@code value} lies within {@code [min, max]}.
   *
   * @param name configuration key used in the message; {@code "value"} when blank
   * @param value candidate
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException when out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value >= min && value <= max) {
      return value;
    }
    throw new IllegalArgumentException(
        label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
  }

  /**
   * Checks that {@code value} is a ratio in {@code [0, 1]}.
   *
   * @param name configuration key used in the message
   * @param value candidate
   * @return {@code value}
   * @throws IllegalArgumentException when NaN or out of range
   */
  public static double requireRatio(String name, double value) {
    if (value >= 0d && value <= 1d) {
      return value;
    }
    throw new IllegalArgumentException(label(name) + " must be between 0 and 1 (was " + value + ")");
  }

  /**
   * Checks that a cadence or timeout is at least one millisecond, the scheduler's resolution.
   *
   * @param name configuration key used in the message
   * @param value candidate duration
   * @return {@code value}
   * @throws IllegalArgumentException when zero, negative or below one millisecond
   */
  public static Duration requirePositive(String name, Duration value) {
    Objects.requireNonNull(value, label(name));
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(label(name) + " must be positive (was " + value + ")");
    }
    if (value.toMillis() < 1) {
      throw new IllegalArgumentException(label(name) + " must be at least 1ms (was " + value + ")");
    }
    return value;
  }

  /**
   * Checks that severity band boundaries are positive and strictly increasing.
   *
   * @param name band family used in the message, for example {@code leak.component}
   * @param bounds boundaries from the lowest band upwards
   * @throws IllegalArgumentException when a boundary is not positive or not above its predecessor
   */
  public static void requireIncreasing(String name, double... bounds) {
    double previous = 0d;
    for (int i = 0; i < bounds.length; i++) {
      if (!(bounds[i] > previous)) {
        throw new IllegalArgumentException(label(name) + " thresholds must be positive and strictly"
            + " increasing (bound " + i + " was " + bounds[i] + " after " + previous + ")");
      }
      previous = bounds[i];
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
