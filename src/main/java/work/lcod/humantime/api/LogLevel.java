package work.lcod.humantime.api;

import java.util.Locale;

/**
 * Log thresholds accepted on the command line.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /**
     * Level name understood by slf4j-simple; it has no fatal level, so that maps to error.
     */
    public String simpleLoggerLevel() {
        return this == FATAL ? "error" : name().toLowerCase(Locale.ROOT);
    }
}
