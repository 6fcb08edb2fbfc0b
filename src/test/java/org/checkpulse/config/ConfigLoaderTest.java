package org.checkpulse.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    private static final UnaryOperator<String> NO_ENV = name -> null;

    @TempDir
    Path dir;

    @Test
    void fallsBackToBundledConfig() {
        XmlConfiguration cfg = ConfigLoader.loadConfig(dir.resolve("absent.xml").toString(), NO_ENV);

        assertEquals("~/.checkpulse", cfg.checks.checkfilesDir);
        assertEquals(10, cfg.checks.checkRunInterval);
        assertEquals(20, cfg.checks.historySize);
        assertFalse(cfg.server.enabled);
        assertEquals("/api", cfg.server.basePath);
    }

    @Test
    void readsGivenFileAndKeepsDefaultsForMissingElements() throws Exception {
        Path xml = Files.writeString(dir.resolve("config.xml"), """
                <configuration>
                    <checks>
                        <checkfilesDir>/srv/checks</checkfilesDir>
                        <checkRunInterval>30</checkRunInterval>
                        <commandTimeoutSeconds>15</commandTimeoutSeconds>
                    </checks>
                    <server>
                        <enabled>true</enabled>
                        <port>9090</port>
                    </server>
                </configuration>
                """);

        XmlConfiguration cfg = ConfigLoader.loadConfig(xml.toString(), NO_ENV);

        assertEquals("/srv/checks", cfg.checks.checkfilesDir);
        assertEquals(30, cfg.checks.checkRunInterval);
        assertEquals(15, cfg.checks.commandTimeoutSeconds);
        assertEquals(250, cfg.checks.reloadDebounceMillis);
        assertTrue(cfg.server.enabled);
        assertEquals(9090, cfg.server.port);
        assertEquals("127.0.0.1", cfg.server.host);
    }

    @Test
    void environmentOverridesFile() {
        Map<String, String> env = Map.of(
                ConfigLoader.ENV_CHECKFILES_DIR, "/tmp/elsewhere",
                ConfigLoader.ENV_RUN_INTERVAL, "3");

        XmlConfiguration cfg = ConfigLoader.loadConfig(null, env::get);

        assertEquals("/tmp/elsewhere", cfg.checks.checkfilesDir);
        assertEquals(3, cfg.checks.checkRunInterval);
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalStateException.class,
                () -> ConfigLoader.loadConfig(null, Map.of(ConfigLoader.ENV_RUN_INTERVAL, "soon")::get));
        assertThrows(IllegalStateException.class,
                () -> ConfigLoader.loadConfig(null, Map.of(ConfigLoader.ENV_RUN_INTERVAL, "0")::get));
    }

    @Test
    void malformedXmlFailsStartup() throws Exception {
        Path xml = Files.writeString(dir.resolve("broken.xml"), "<configuration><checks>");

        var e = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadConfig(xml.toString(), NO_ENV));
        assertTrue(e.getMessage().startsWith("Failed to load config file!"));
    }

    @Test
    void expandsHomeDirectory() {
        String home = System.getProperty("user.home");

        assertEquals(Path.of(home, ".checkpulse"), ConfigLoader.resolvePath("~/.checkpulse"));
        assertEquals(Path.of(home), ConfigLoader.resolvePath("~"));
        assertEquals(Path.of("/etc/checks"), ConfigLoader.resolvePath("/etc/checks"));
    }
}
