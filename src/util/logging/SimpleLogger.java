package util.logging;

import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default {@link Logger}: formats the message and hands it to {@link LogManager}
 */
public class SimpleLogger implements Logger {
    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{}");

    private final String name;
    private volatile LogLevel level;

    public SimpleLogger(String name, LogLevel level) {
        this.name = name;
        this.level = level;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public LogLevel getLevel() {
        return level;
    }

    @Override
    public void setLevel(LogLevel level) {
        this.level = level;
    }

    @Override
    public void trace(String format, Object... args) {
        log(LogLevel.TRACE, format, args);
    }

    @Override
    public void debug(String format, Object... args) {
        log(LogLevel.DEBUG, format, args);
    }

    @Override
    public void info(String format, Object... args) {
        log(LogLevel.INFO, format, args);
    }

    @Override
    public void warn(String format, Object... args) {
        log(LogLevel.WARN, format, args);
    }

    @Override
    public void error(String format, Object... args) {
        log(LogLevel.ERROR, format, args);
    }

    @Override
    public void fatal(String format, Object... args) {
        log(LogLevel.FATAL, format, args);
    }

    @Override
    public boolean isEnabled(LogLevel msgLevel) {
        return msgLevel != LogLevel.OFF && !msgLevel.isLessSpecificThan(level);
    }

    private void log(LogLevel msgLevel, String format, Object... args) {
        if (!isEnabled(msgLevel) || !LogManager.hasAppender()) {
            return;
        }
        String timestamp = new SimpleDateFormat("yyyy-MM-dd HH:mm:ss,SSS").format(new Date());
        String context = LogManager.getContext();
        String logMessage = String.format("%s %s [%s] %s - %s",
                context != null ? context : "-",
                timestamp,
                msgLevel,
                name,
                formatMessage(format, args));
        LogManager.writeLog(msgLevel, logMessage);
    }

    static String formatMessage(String format, Object... args) {
        if (args == null || args.length == 0) {
            return format;
        }
        StringBuilder result = new StringBuilder();
        int argIndex = 0;
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(format);
        while (matcher.find()) {
            if (argIndex < args.length) {
                Object arg = args[argIndex++];
                matcher.appendReplacement(result, Matcher.quoteReplacement(String.valueOf(arg)));
            } else {
                matcher.appendReplacement(result, "{}");
            }
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
