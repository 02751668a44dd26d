package util.logging;

import driver.Config;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import util.LoggingManager;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LogManagerTest {

    @AfterEach
    void restoreDefaults() {
        System.clearProperty("log.file");
        Config.reload();
        LoggingManager.reconfigure();
        LogManager.setRootLevel(LogLevel.INFO);
    }

    @Test
    void rootLevelChangeKeepsExplicitLevels() {
        Logger pinned = LogManager.getLogger("LogManagerTest.pinned", LogLevel.ERROR);
        Logger following = LogManager.getLogger("LogManagerTest.following", null);

        LogManager.setRootLevel(LogLevel.DEBUG);

        assertThat(pinned.getLevel()).isEqualTo(LogLevel.ERROR);
        assertThat(following.getLevel()).isEqualTo(LogLevel.DEBUG);
    }

    @Test
    void reconfigureTurnsFileLoggingOff() throws IOException {
        System.setProperty("log.file", "true");
        Config.reload();
        LoggingManager.reconfigure();
        assertThat(LogManager.hasAppender()).isTrue();

        System.setProperty("log.file", "false");
        Config.reload();
        LoggingManager.reconfigure();

        assertThat(LogManager.hasAppender()).isFalse();
        Optional<File> logFile = newestLogFile();
        assertThat(logFile).isPresent();
        long before = logFile.get().length();
        LogManager.writeLog(LogLevel.ERROR, "must not reach the file");
        assertThat(logFile.get().length()).isEqualTo(before);
        Files.deleteIfExists(logFile.get().toPath());
    }

    @Test
    void fileIsWrittenAsUtf8() throws IOException {
        System.setProperty("log.file", "true");
        Config.reload();
        LoggingManager.reconfigure();

        LogManager.writeLog(LogLevel.INFO, "λ ← x");
        LogManager.disableFile();

        File logFile = newestLogFile().orElseThrow();
        assertThat(Files.readString(logFile.toPath(), StandardCharsets.UTF_8)).contains("λ ← x");
        Files.deleteIfExists(logFile.toPath());
    }

    private static Optional<File> newestLogFile() {
        File[] files = new File("logs").listFiles((dir, name) -> name.startsWith("localopts"));
        if (files == null) {
            return Optional.empty();
        }
        return Arrays.stream(files).max(Comparator.comparingLong(File::lastModified));
    }
}
