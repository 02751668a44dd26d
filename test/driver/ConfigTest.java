package driver;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import util.logging.LogLevel;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("opt.level");
        System.clearProperty("debug");
        System.clearProperty("log.level");
        Config.reload();
    }

    @Test
    void defaultsAreOffAndO0() {
        System.clearProperty("opt.level");
        System.clearProperty("debug");
        Config.reload();

        Config config = Config.getInstance();
        assertThat(config.isO1).isFalse();
        assertThat(config.isDebug).isFalse();
        assertThat(config.logLevel).isEqualTo(LogLevel.INFO);
    }

    @Test
    void readsSystemPropertiesOnReload() {
        System.setProperty("opt.level", "o1");
        System.setProperty("debug", "TRUE");
        Config.reload();

        assertThat(Config.getInstance().isO1).isTrue();
        assertThat(Config.getInstance().isDebug).isTrue();
        assertThat(Config.getInstance().logLevel).isEqualTo(LogLevel.DEBUG);
    }

    @Test
    void explicitLogLevelWinsOverDebug() {
        System.setProperty("debug", "true");
        System.setProperty("log.level", "warn");
        Config.reload();

        assertThat(Config.getInstance().logLevel).isEqualTo(LogLevel.WARN);
    }

    @Test
    void flagsMustBeExactlyTrue() {
        System.setProperty("debug", "yes");

        assertThat(Config.getFlag("debug")).isFalse();
        assertThat(Config.getFlag("no.such.flag")).isFalse();
    }
}
