package org.evmkit.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConfigLoader}: layer precedence and file selection.
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("vm.max-stack-depth");
        System.clearProperty("config.file");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should layer the file over the built-in defaults")
    void loadFromFile_shouldLoadConfigFileWithDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals(16, config.getInt("vm.max-stack-depth"));
        assertEquals(4096, config.getLong("vm.max-memory-bytes"));
        assertEquals(100, config.getLong("cli.max-steps"));
        assertEquals("ERROR", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("vm.max-stack-depth", "64");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals(64, config.getInt("vm.max-stack-depth"));
        assertEquals(4096, config.getLong("vm.max-memory-bytes"));
    }

    @Test
    @DisplayName("loadDefaults should expose reference.conf")
    void loadDefaults_shouldExposeReferenceConfig() {
        Config config = ConfigLoader.loadDefaults();

        assertEquals(1024, config.getInt("vm.max-stack-depth"));
        assertEquals(10_000_000L, config.getLong("vm.max-memory-bytes"));
        assertEquals(0, config.getLong("cli.max-steps"));
        assertEquals("WARN", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("resolve should use an explicitly named file and report it")
    void resolve_explicitFile() {
        List<String> messages = new ArrayList<>();
        Config config = ConfigLoader.resolve(testResource("test-config.conf"),
                (level, message) -> messages.add(level + " " + message));

        assertEquals(16, config.getInt("vm.max-stack-depth"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO Using configuration file specified via --config"));
    }

    @Test
    @DisplayName("resolve should fail for a missing explicit file")
    void resolve_missingExplicitFile() {
        File missing = new File("does-not-exist/evmkit.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, (level, message) -> { }));
        assertTrue(e.getMessage().startsWith("Configuration file not found"));
    }

    @Test
    @DisplayName("resolve should use -Dconfig.file when no explicit file is given")
    void resolve_systemPropertyFile() {
        System.setProperty("config.file", testResource("test-config.conf").getAbsolutePath());
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(null, (level, message) -> messages.add(message));

        assertEquals(16, config.getInt("vm.max-stack-depth"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("Using configuration file specified via -Dconfig.file"));
    }

    @Test
    @DisplayName("resolve should fall back to the defaults when no file is found")
    void resolve_fallsBackToDefaults() {
        List<String> messages = new ArrayList<>();
        Config config = ConfigLoader.resolve(null, (level, message) -> messages.add(message));

        assertEquals(1024, config.getInt("vm.max-stack-depth"));
        assertEquals(List.of("No 'config/evmkit.conf' found, using built-in defaults."), messages);
    }

    private File testResource(final String name) {
        final URL url = getClass().getResource("/" + name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
