package ca.gc.cra.stratum.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts Stratum runtime logging from the resolved {@code log-level-console} option.
 * <p><strong>Why:</strong> Lets operators raise verbosity during troubleshooting without editing
 * {@code logback.xml}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Detect the active SLF4J implementation and adjust the root logging level.</li>
 *   <li>Warn when the backend does not support dynamic level changes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Applies a console log level name such as {@code warn} or {@code detail}.
   *
   * @param name level name; {@code off}, {@code error}, {@code warn}, {@code info}, {@code detail},
   *     {@code debug}, or {@code trace}
   * @return {@code true} when the name was recognized
   */
  public static boolean applyLevel(String name) {
    Optional<Level> level = levelOf(name);
    level.ifPresent(LoggingConfigurator::setRootLevel);
    return level.isPresent();
  }

  static Optional<Level> levelOf(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "off" -> Optional.of(Level.OFF);
      case "error" -> Optional.of(Level.ERROR);
      case "warn" -> Optional.of(Level.WARN);
      case "info", "detail" -> Optional.of(Level.INFO);
      case "debug" -> Optional.of(Level.DEBUG);
      case "trace" -> Optional.of(Level.TRACE);
      default -> Optional.empty();
    };
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
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
  }
}
