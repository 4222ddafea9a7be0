package ca.gc.cra.dart.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts DART logging verbosity at runtime from CLI flags.
 * <p><strong>Why:</strong> Operators triaging an unexpected report need per-file and per-overwrite diagnostics
 * without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Only Logback supports the level change; other SLF4J bindings keep their configured levels.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  /** Logger namespace that {@code --verbose} raises to DEBUG. */
  public static final String DART_LOGGER = "ca.gc.cra.dart";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the {@code ca.gc.cra.dart} and root loggers to DEBUG.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    return setLevel(Level.DEBUG);
  }

  /**
   * Restores the {@code ca.gc.cra.dart} logger to inherit from root and root to INFO.
   *
   * <p>Used by tests that toggle verbosity within one JVM.</p>
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean resetLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      context.getLogger(DART_LOGGER).setLevel(null);
      context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.INFO);
      return true;
    }
    return false;
  }

  private static boolean setLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      context.getLogger(DART_LOGGER).setLevel(level);
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
