package org.fleetfeast.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies {@code fleetfeast.logging.levels} to Logback. The key {@code root} sets the root level,
 * every other key is a logger name.
 */
public final class LoggingConfigurator {

    private static final String LEVELS_PATH = ConfigLoader.ROOT + ".logging.levels";

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!config.hasPath(LEVELS_PATH)) {
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        for (Map.Entry<String, ConfigValue> entry : config.getObject(LEVELS_PATH).entrySet()) {
            String loggerName = "root".equalsIgnoreCase(entry.getKey()) ? Logger.ROOT_LOGGER_NAME : entry.getKey();
            String levelName = String.valueOf(entry.getValue().unwrapped());
            Level level = Level.toLevel(levelName, null);
            if (level == null) {
                throw new IllegalArgumentException("Unknown log level '" + levelName + "' for logger '" + entry.getKey() + "'");
            }
            context.getLogger(loggerName).setLevel(level);
        }
    }
}
