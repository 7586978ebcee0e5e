package com.gentoro.kbgen.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Central place to obtain SLF4J loggers and apply level overrides from configuration. */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Applies {@code logging.level.<logger>: <LEVEL>} entries on top of logback.xml. The key
   * {@code root} addresses the root logger. Unknown levels are skipped with a warning.
   *
   * @return number of loggers whose level was changed
   */
  public static int applyConfiguration(Configuration cfg) {
    if (cfg == null) return 0;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      log.warn("Logback is not the active SLF4J binding; ignoring {}.*", LEVEL_PREFIX);
      return 0;
    }
    Configuration levels = cfg.subset(LEVEL_PREFIX);
    int applied = 0;
    for (Iterator<String> keys = levels.getKeys(); keys.hasNext(); ) {
      String name = keys.next();
      String value = levels.getString(name, "");
      Level level = Level.toLevel(value.trim(), null);
      if (level == null) {
        log.warn("Unknown log level '{}' for logger '{}'; ignoring", value, name);
        continue;
      }
      String loggerName = "root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name;
      ctx.getLogger(loggerName).setLevel(level);
      applied++;
    }
    if (applied > 0) {
      log.debug("Applied {} log level override(s)", applied);
    }
    return applied;
  }
}
