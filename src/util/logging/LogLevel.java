package util.logging;

/**
 * Severity of a log message, ordered from the most verbose to the most severe
 */
public enum LogLevel {
    TRACE(0),
    DEBUG(1),
    INFO(2),
    WARN(3),
    ERROR(4),
    FATAL(5),
    OFF(6);

    private final int value;

    LogLevel(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * @return true if this level is more verbose than {@code other}
     *         (messages at this level are filtered out by a logger set to {@code other})
     */
    public boolean isLessSpecificThan(LogLevel other) {
        return this.value < other.value;
    }

    public static LogLevel parse(String name, LogLevel fallback) {
        if (name == null || name.isBlank()) {
            return fallback;
        }
        try {
            return LogLevel.valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
