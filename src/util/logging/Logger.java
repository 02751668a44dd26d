package util.logging;

/**
 * Logger facade; messages take SLF4J style {} placeholders
 */
public interface Logger {
    String getName();

    LogLevel getLevel();

    void setLevel(LogLevel level);

    void trace(String format, Object... args);
    void debug(String format, Object... args);
    void info(String format, Object... args);
    void warn(String format, Object... args);
    void error(String format, Object... args);
    void fatal(String format, Object... args);

    boolean isEnabled(LogLevel level);

    default boolean isTraceEnabled() { return isEnabled(LogLevel.TRACE); }
    default boolean isDebugEnabled() { return isEnabled(LogLevel.DEBUG); }
    default boolean isInfoEnabled() { return isEnabled(LogLevel.INFO); }
}
