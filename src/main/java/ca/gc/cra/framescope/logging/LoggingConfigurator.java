package ca.gc.cra.framescope.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts logging verbosity for CLI-driven runs.
 * <p><strong>Why:</strong> Frame lines are emitted at DEBUG and decode detail at TRACE; operators raise verbosity
 * from the command line instead of editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  /** Logger name that receives one line per captured frame. */
  public static final String FRAME_LOGGER = "ca.gc.cra.framescope.frames";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger to DEBUG so frame lines become visible.
   */
  public static void enableVerboseLogging() {
    setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, Level.DEBUG);
  }

  /**
   * Elevates the frame logger to TRACE so decoded payload detail lines are emitted.
   */
  public static void enablePayloadTracing() {
    setLevel(FRAME_LOGGER, Level.TRACE);
  }

  private static void setLevel(String loggerName, Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger target = context.getLogger(loggerName);
      if (!level.equals(target.getLevel())) {
        target.setLevel(level);
      }
      return;
    }
    log.warn("Log level change for {} requested but backend {} does not support dynamic level updates",
        loggerName, factory.getClass().getName());
  }
}
