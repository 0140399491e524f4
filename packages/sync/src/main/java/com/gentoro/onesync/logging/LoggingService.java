package com.gentoro.onesync.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logger lookup plus level overrides taken from the application configuration. */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  static final String LEVELS_KEY = "logging.level";
  private static final String ROOT_KEY = "root";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Applies {@code logging.level.<logger>: <LEVEL>} entries on top of {@code logback.xml}. The
   * {@code root} entry addresses the root logger. Unknown levels are reported and skipped.
   *
   * <pre>
   * logging:
   *   level:
   *     root: INFO
   *     com.gentoro.onesync.sync: DEBUG
   * </pre>
   */
  public static void applyConfiguration(Configuration cfg) {
    if (cfg == null) return;
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext)) {
      log.warn("Logback is not the active SLF4J backend, ignoring {} overrides", LEVELS_KEY);
      return;
    }
    LoggerContext context = (LoggerContext) factory;

    Configuration levels = cfg.subset(LEVELS_KEY);
    levels
        .getKeys()
        .forEachRemaining(
            key -> {
              // dotted logger names come back with escaped delimiters
              String loggerName =
                  ROOT_KEY.equalsIgnoreCase(key) ? Logger.ROOT_LOGGER_NAME : key.replace("..", ".");
              String value = levels.getString(key, null);
              Level level = value == null ? null : Level.toLevel(value.trim(), null);
              if (level == null) {
                log.warn("Unknown log level '{}' for logger {}, ignoring", value, loggerName);
                return;
              }
              context.getLogger(loggerName).setLevel(level);
              log.debug("Logger {} set to {}", loggerName, level);
            });
  }
}
