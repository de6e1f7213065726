package com.gentoro.fetchgate.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Central access point for loggers and runtime log level configuration. */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply {@code logging.level.<logger>: <LEVEL>} entries to Logback. The special logger name
   * {@code root} targets the root logger. Unknown level names are reported and skipped.
   */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      getLogger(LoggingService.class)
          .warn("Logback is not the active SLF4J backend, skipping level configuration");
      return;
    }

    Configuration levels = configuration.subset(LEVEL_PREFIX);
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String name = keys.next();
      String value = levels.getString(name);
      if (value == null || value.isBlank()) continue;
      // hierarchical keys escape the dots of a dotted YAML key as ".."
      String unescaped = name.replace("..", ".");
      String loggerName =
          "root".equalsIgnoreCase(unescaped) ? Logger.ROOT_LOGGER_NAME : unescaped;
      Level level = Level.toLevel(value.trim(), null);
      if (level == null) {
        getLogger(LoggingService.class)
            .warn("Ignoring unknown log level '{}' for logger '{}'", value, loggerName);
        continue;
      }
      context.getLogger(loggerName).setLevel(level);
    }
  }
}
