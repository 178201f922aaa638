package ca.gc.cra.soak.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Optional;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Switches the monitor's own loggers between their configured level and DEBUG.
 * <p><strong>Why:</strong> {@code verbose=true} surfaces per-cycle snapshot, health and tracker detail
 * without touching the host application's loggers or editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Call during wiring, before a session starts.</p>
 *
 * @implNote Logback only; other SLF4J bindings are left untouched and reported with a warning.
 * @since SOAK 0.1
 */
public final class LoggingConfigurator {
  /** Logger namespace that covers every monitor class. */
  public static final String MONITOR_LOGGER = "ca.gc.cra.soak";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Sets the monitor namespace to DEBUG.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    return setMonitorLevel(Level.DEBUG).isPresent();
  }

  /**
   * Sets the level of the monitor namespace.
   *
   * @param level new level; {@code null} restores inheritance from the root logger
   * @return the effective level before the change; empty when the backend is not Logback
   */
  public static Optional<Level> setMonitorLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Cannot change monitor log level; backend {} is not Logback",
          factory.getClass().getName());
      return Optional.empty();
    }
    Logger monitor = context.getLogger(MONITOR_LOGGER);
    Level previous = monitor.getEffectiveLevel();
    monitor.setLevel(level);
    if (level != null && !level.equals(previous)) {
      log.info("Monitor log level changed from {} to {}", previous, level);
    }
    return Optional.of(previous);
  }
}
