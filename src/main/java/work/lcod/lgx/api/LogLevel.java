package work.lcod.lgx.api;

import java.util.Locale;

/**
 * Diagnostic thresholds understood by the CLI and the settings file.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

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
     * Value accepted by {@code org.slf4j.simpleLogger.defaultLogLevel}.
     */
    public String simpleLoggerName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
