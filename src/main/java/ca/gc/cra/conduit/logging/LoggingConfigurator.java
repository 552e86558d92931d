package ca.gc.cra.conduit.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts conduit runtime logging for CLI-driven sessions.
 * <p><strong>Why:</strong> Lets operators raise verbosity while diagnosing a tunnel without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    setRootLevel(Level.DEBUG);
  }

  /**
   * Sets the level of a named logger, for example to silence noisy packages in tests.
   *
   * @param loggerName logger name or {@link org.slf4j.Logger#ROOT_LOGGER_NAME}
   * @param level textual Logback level such as {@code WARN}
   */
  public static void setLevel(String loggerName, String level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      context.getLogger(loggerName).setLevel(Level.toLevel(level, Level.INFO));
      return;
    }
    log.warn("Logger level change for {} ignored; backend {} does not support dynamic updates",
        loggerName, factory.getClass().getName());
  }

  private static void setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
