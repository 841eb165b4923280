package com.ourd.server;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Applies {@code log.level} from the configuration to the Logback root logger. Unknown levels
 * fall back to DEBUG.
 */
public final class LoggingSetup {

    private LoggingSetup() {
    }

    public static Level apply(String configuredLevel) {
        Level level = parseLevel(configuredLevel);
        Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.setLevel(level);
        return level;
    }

    static Level parseLevel(String value) {
        if (value == null) {
            return Level.DEBUG;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "trace" -> Level.TRACE;
            case "debug" -> Level.DEBUG;
            case "info" -> Level.INFO;
            case "warn", "warning" -> Level.WARN;
            case "error", "fatal", "panic" -> Level.ERROR;
            default -> Level.DEBUG;
        };
    }
}
