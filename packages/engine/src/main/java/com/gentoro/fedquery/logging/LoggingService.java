package com.gentoro.fedquery.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for obtaining loggers and applying log levels from the application configuration.
 *
 * <p>Levels are read from keys of the form {@code logging.level.<logger-name>}, for example:
 *
 * <pre>{@code
 * logging:
 *   level:
 *     root: WARN
 *     com.gentoro.fedquery: DEBUG
 * }</pre>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  public static Logger getLogger(String name) {
    return LoggerFactory.getLogger(name);
  }

  /**
   * Apply {@code logging.level.*} entries to Logback. Unknown level names are ignored with a
   * warning; non-Logback SLF4J bindings are left untouched.
   */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) {
      return;
    }
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return;
    }
    Logger self = getLogger(LoggingService.class);
    Configuration levels = configuration.subset(LEVEL_PREFIX);
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String loggerName = it.next();
      String value = levels.getString(loggerName);
      // YAML keys containing dots come back with the dots doubled
      String name = loggerName.replace("..", ".");
      Level level = Level.toLevel(value, null);
      if (level == null) {
        self.warn("Ignoring unknown log level '{}' for logger '{}'", value, name);
        continue;
      }
      String target = "root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name;
      context.getLogger(target).setLevel(level);
      self.debug("Log level for '{}' set to {}", target, level);
    }
  }
}
