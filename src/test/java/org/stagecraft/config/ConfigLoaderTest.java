package org.stagecraft.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * system properties, then the configuration file, then reference.conf.
 */
@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("stagecraft.emit.debug-info");
        ConfigFactory.invalidateCaches();
    }

    private File writeConfig(String content) throws IOException {
        Path file = tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file.toFile();
    }

    @Test
    @DisplayName("Should fall back to reference.conf when the file does not exist")
    void load_shouldUseReferenceDefaultsWithoutFile() {
        // Act
        Config config = ConfigLoader.load(tempDir.resolve("missing.conf").toFile());

        // Assert
        assertEquals("NONE", config.getString("stagecraft.emit.debug-info"));
        assertEquals("FAIL_CLOSED", config.getString("stagecraft.emit.emission-policy"));
        assertTrue(config.getBoolean("stagecraft.compilation.concurrent-build"));
    }

    @Test
    @DisplayName("File values should override defaults and keep the rest")
    void load_fileShouldOverrideDefaults() throws IOException {
        // Arrange
        File file = writeConfig("stagecraft.emit.debug-info = EMBEDDED\n");

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertEquals("EMBEDDED", config.getString("stagecraft.emit.debug-info"));
        assertEquals("FAIL_CLOSED", config.getString("stagecraft.emit.emission-policy"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFile() throws IOException {
        // Arrange
        File file = writeConfig("stagecraft.emit.debug-info = EMBEDDED\n");
        System.setProperty("stagecraft.emit.debug-info", "SEPARATE");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertEquals("SEPARATE", config.getString("stagecraft.emit.debug-info"));
    }

    @Test
    @DisplayName("A directory in place of the file should be skipped")
    void load_shouldSkipDirectory() {
        Config config = ConfigLoader.load(tempDir.toFile());

        assertEquals("NONE", config.getString("stagecraft.emit.debug-info"));
    }
}
