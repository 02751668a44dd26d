package util;

import driver.Config;
import util.logging.LogManager;
import util.logging.Logger;

/**
 * Applies {@link Config} to the logging system before the first logger is
 * handed out. Passes and IR classes get their loggers here.
 */
public class LoggingManager {
    private static boolean configured = false;

    public static synchronized void init() {
        if (configured) return;
        apply(Config.getInstance());
        configured = true;
    }

    /**
     * Re-apply the current {@link Config}, e.g. after {@link Config#reload()}
     */
    public static synchronized void reconfigure() {
        configured = false;
        init();
    }

    private static void apply(Config config) {
        LogManager.setRootLevel(config.logLevel);
        if (config.logToConsole) {
            LogManager.enableConsole();
        } else {
            LogManager.disableConsole();
        }
        if (config.logToFile) {
            LogManager.enableFile();
        } else {
            LogManager.disableFile();
        }
    }

    public static Logger getLogger(Class<?> cls) {
        init();
        return LogManager.getLogger(cls);
    }
}
