package driver;

import util.logging.LogLevel;

/*
 * configuration of the optimizer, read from JVM system properties
 * eg: -Ddebug=true -Dlog.console=true -Dopt.level=O1
 */
public class Config {
    private static Config config = new Config();

    public boolean isO1 = false;
    public boolean isDebug = false;
    public boolean logToConsole = false;
    public boolean logToFile = false;
    // -Dlog.level wins over -Ddebug
    public LogLevel logLevel = LogLevel.INFO;

    private Config() {
        isDebug = getFlag("debug");
        logToConsole = getFlag("log.console");
        logToFile = getFlag("log.file");
        isO1 = "O1".equalsIgnoreCase(System.getProperty("opt.level", "O0").trim());
        logLevel = LogLevel.parse(System.getProperty("log.level"), isDebug ? LogLevel.DEBUG : LogLevel.INFO);
    }

    /**
     * @return true only if the property is set to "true", in any case
     */
    public static boolean getFlag(String name) {
        String raw = System.getProperty(name);
        return raw != null && raw.equalsIgnoreCase("true");
    }

    public static Config getInstance() {
        return config;
    }

    /**
     * Re-read the system properties (used by tests that flip options)
     */
    public static void reload() {
        config = new Config();
    }
}
