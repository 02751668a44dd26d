package util.logging;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates {@link Logger}s and owns the appenders (console and/or file).
 * Both appenders start switched off; {@link util.LoggingManager} turns them on from the configuration.
 */
public class LogManager {
    private static final String LOG_DIRECTORY = "logs";
    private static final Map<String, Logger> loggers = new ConcurrentHashMap<>();
    // loggers created with their own level; setRootLevel leaves them alone
    private static final Set<String> pinnedLevels = ConcurrentHashMap.newKeySet();
    private static final Object FILE_LOCK = new Object();

    private static LogLevel rootLevel = LogLevel.INFO;
    private static volatile boolean consoleEnabled = false;
    private static volatile boolean fileEnabled = false;
    private static PrintWriter fileWriter;

    // what is being processed right now, e.g. the module name; printed in every line
    private static volatile String context;

    private LogManager() {
    }

    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName(), null);
    }

    /**
     * @param level explicit level for this logger, or null to follow the root level
     */
    public static synchronized Logger getLogger(String name, LogLevel level) {
        return loggers.computeIfAbsent(name, n -> {
            if (level != null) {
                pinnedLevels.add(n);
            }
            return new SimpleLogger(n, level != null ? level : rootLevel);
        });
    }

    private static void openLogFile() {
        File logDir = new File(LOG_DIRECTORY);
        if (!logDir.exists() && !logDir.mkdirs()) {
            System.err.println("[LogManager] cannot create log directory " + logDir.getAbsolutePath());
            return;
        }
        try {
            File logFile = new File(logDir, "localopts" + System.currentTimeMillis() + ".log");
            synchronized (FILE_LOCK) {
                fileWriter = new PrintWriter(new FileWriter(logFile, StandardCharsets.UTF_8, true), true);
            }
            fileEnabled = true;
        } catch (IOException e) {
            System.err.println("[LogManager] file logging disabled: " + e.getMessage());
            fileEnabled = false;
        }
    }

    /**
     * Set the root log level; existing loggers follow unless they were created with their own level
     */
    public static synchronized void setRootLevel(LogLevel level) {
        rootLevel = level;
        loggers.forEach((name, logger) -> {
            if (!pinnedLevels.contains(name)) {
                logger.setLevel(level);
            }
        });
    }

    public static synchronized LogLevel getRootLevel() {
        return rootLevel;
    }

    public static void setContext(String ctx) {
        context = ctx;
    }

    public static String getContext() {
        return context;
    }

    static boolean hasAppender() {
        return consoleEnabled || fileEnabled;
    }

    static void writeLog(LogLevel level, String message) {
        if (consoleEnabled) {
            if (level.getValue() >= LogLevel.WARN.getValue()) {
                System.err.println(message);
            } else {
                System.out.println(message);
            }
        }
        if (fileEnabled) {
            synchronized (FILE_LOCK) {
                if (fileWriter != null) {
                    fileWriter.println(message);
                }
            }
        }
    }

    public static void enableConsole() {
        consoleEnabled = true;
    }

    public static void disableConsole() {
        consoleEnabled = false;
    }

    public static synchronized void enableFile() {
        if (fileWriter == null) {
            openLogFile();
        } else {
            fileEnabled = true;
        }
    }

    public static void disableFile() {
        fileEnabled = false;
        shutdown();
    }

    /**
     * Close the log file, if any
     */
    public static void shutdown() {
        synchronized (FILE_LOCK) {
            if (fileWriter != null) {
                fileWriter.close();
                fileWriter = null;
            }
        }
    }
}
