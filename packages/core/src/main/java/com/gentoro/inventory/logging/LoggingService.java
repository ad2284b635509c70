package com.gentoro.inventory.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers. Levels can be overridden from configuration using {@code
 * logging.level.root} and {@code logging.level.<logger-name>} keys.
 */
public final class LoggingService {
  static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  public static Logger getLogger(String name) {
    return LoggerFactory.getLogger(name);
  }

  /**
   * Apply logger levels found under {@code logging.level} to the Logback context. Unknown level
   * names fall back to DEBUG, as Logback does. A no-op when SLF4J is bound to another backend.
   *
   * @return number of loggers whose level was set
   */
  public static int applyConfiguration(Configuration configuration) {
    if (configuration == null) return 0;
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      return 0;
    }

    int applied = 0;
    Iterator<String> keys = configuration.getKeys(LEVEL_PREFIX);
    while (keys.hasNext()) {
      String key = keys.next();
      if (key.length() <= LEVEL_PREFIX.length() + 1) continue;
      // YAML keys that contain dots come back escaped as ".."
      String loggerName = key.substring(LEVEL_PREFIX.length() + 1).replace("..", ".");
      String value = configuration.getString(key);
      if (value == null || value.isBlank()) continue;

      String name = "root".equalsIgnoreCase(loggerName) ? Logger.ROOT_LOGGER_NAME : loggerName;
      context.getLogger(name).setLevel(Level.toLevel(value.trim(), Level.DEBUG));
      applied++;
    }
    return applied;
  }
}
