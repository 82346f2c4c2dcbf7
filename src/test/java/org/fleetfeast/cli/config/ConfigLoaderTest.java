package org.fleetfeast.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final List<String> messages = new ArrayList<>();

    private void collect(ConfigLoader.MessageLevel level, String message) {
        messages.add(level + " " + message);
    }

    private File write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file.toFile();
    }

    @Test
    @DisplayName("An explicit file overrides defaults and its world reaches the services")
    void explicitFile() throws IOException {
        File file = write("custom.conf", "fleetfeast.world.dayLength = 720\nfleetfeast.http.sseKeepAliveSeconds = 5\n");

        Config config = ConfigLoader.resolve(file, null, this::collect);

        assertThat(config.getInt("fleetfeast.http.sseKeepAliveSeconds")).isEqualTo(5);
        assertThat(config.getInt("fleetfeast.pipeline.services.simulation-loop.options.world.dayLength")).isEqualTo(720);
        assertThat(config.getInt("fleetfeast.pipeline.services.agent-bridge.options.world.dayLength")).isEqualTo(720);
        assertThat(config.getConfigList("fleetfeast.world.zones")).hasSize(5);
        assertThat(messages).singleElement().asString().startsWith("INFO").contains("--config");
    }

    @Test
    void missingExplicitFileIsAnError() {
        File missing = tempDir.resolve("nope.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.resolve(missing, null, this::collect))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope.conf");
    }

    @Test
    void workingDirectoryFileIsUsedWhenNoneIsGiven() throws IOException {
        File file = write("fleetfeast.conf", "fleetfeast.http.sseKeepAliveSeconds = 7\n");

        Config config = ConfigLoader.resolve(null, file, this::collect);

        assertThat(config.getInt("fleetfeast.http.sseKeepAliveSeconds")).isEqualTo(7);
        assertThat(messages).singleElement().asString().contains("current directory");
    }

    @Test
    void defaultsWhenNoFileExists() {
        Config config = ConfigLoader.resolve(null, tempDir.resolve("absent.conf").toFile(), this::collect);

        assertThat(config.getStringList("fleetfeast.pipeline.startupSequence"))
                .containsExactly("simulation-loop", "agent-bridge");
        assertThat(config.getInt("fleetfeast.world.dayLength")).isEqualTo(1440);
        assertThat(messages).singleElement().asString().startsWith("WARN");
    }

    @Test
    void invalidHoconIsReported() throws IOException {
        File file = write("broken.conf", "fleetfeast { http { port = \n");

        assertThatThrownBy(() -> ConfigLoader.resolve(file, null, this::collect))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void loggingLevelsAreApplied() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Level before = context.getLogger("org.fleetfeast.test.levels").getLevel();
        try {
            LoggingConfigurator.configure(ConfigFactory.parseString(
                    "fleetfeast.logging.levels { \"org.fleetfeast.test.levels\" = DEBUG }"));
            assertThat(context.getLogger("org.fleetfeast.test.levels").getLevel()).isEqualTo(Level.DEBUG);
        } finally {
            context.getLogger("org.fleetfeast.test.levels").setLevel(before);
        }
    }

    @Test
    void unknownLoggingLevelIsRejected() {
        Config config = ConfigFactory.parseString("fleetfeast.logging.levels { root = LOUD }");

        assertThatThrownBy(() -> LoggingConfigurator.configure(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("LOUD");
    }
}
