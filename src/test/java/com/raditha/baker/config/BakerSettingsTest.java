package com.raditha.baker.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BakerSettingsTest {

    @TempDir
    Path tempDir;

    private Path copyFixture() throws IOException {
        Path target = tempDir.resolve("baker.yml");
        try (InputStream in = getClass().getResourceAsStream("/baker-test.yml")) {
            assertNotNull(in, "fixture missing");
            Files.copy(in, target);
        }
        return target;
    }

    @Test
    void testLoadFromYaml() throws IOException {
        BakerConfig config = BakerSettings.loadConfig(copyFixture(), null, null);

        assertEquals("Acme\\Shop\\Extra", config.namespace());
        assertTrue(config.stripOpenTag());
        assertEquals(List.of("**/generated/**"), config.excludePatterns());
        assertEquals(List.of("php"), config.extensions());

        DeterminismCatalogue catalogue = config.catalogue();
        assertTrue(catalogue.lookup("hrtime").orElseThrow().isAlwaysDynamic());
        assertEquals(1, catalogue.lookup("date_create").orElseThrow().thresholdValue().getAsInt());
        assertFalse(catalogue.contains("curl_exec"));
        assertTrue(catalogue.contains("time"));
    }

    @Test
    void testCliOverridesYaml() throws IOException {
        BakerConfig config = BakerSettings.loadConfig(copyFixture(), "Other\\Pkg", false);

        assertEquals("Other\\Pkg", config.namespace());
        assertFalse(config.stripOpenTag());
    }

    @Test
    void testDefaultsWithoutBakerSection() {
        BakerConfig config = BakerSettings.loadConfig(Map.<String, Object>of("other", Map.of()), null, null);

        assertEquals(BakerConfig.defaults(), config);
    }

    @Test
    void testCliOverridesDefaults() {
        BakerConfig config = BakerSettings.loadConfig(Map.of(), "Acme\\Shop", true);

        assertEquals("Acme\\Shop", config.namespace());
        assertTrue(config.stripOpenTag());
    }

    @Test
    void testReplaceCatalogue() throws IOException {
        Path file = tempDir.resolve("replace.yml");
        Files.writeString(file, """
                baker:
                  catalogue:
                    replace: true
                    add:
                      hrtime: ~
                """);

        BakerConfig config = BakerSettings.loadConfig(file, null, null);

        assertEquals(1, config.catalogue().size());
        assertTrue(config.catalogue().contains("hrtime"));
        assertEquals(BakerConfig.defaults().excludePatterns(), config.excludePatterns());
    }

    @Test
    void testInvalidThreshold() throws IOException {
        Path file = tempDir.resolve("invalid.yml");
        Files.writeString(file, """
                baker:
                  catalogue:
                    add:
                      hrtime: often
                """);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> BakerSettings.loadConfig(file, null, null));
        assertTrue(e.getMessage().contains("hrtime"));
    }

    @Test
    void testZeroThresholdRejected() throws IOException {
        Path file = tempDir.resolve("zero.yml");
        Files.writeString(file, """
                baker:
                  catalogue:
                    add:
                      date: 0
                """);

        assertThrows(IllegalArgumentException.class, () -> BakerSettings.loadConfig(file, null, null));
    }

    @Test
    void testEmptyFile() throws IOException {
        Path file = tempDir.resolve("empty.yml");
        Files.writeString(file, "");

        assertEquals(BakerConfig.defaults(), BakerSettings.loadConfig(file, null, null));
    }

    @Test
    void testMissingFile() {
        assertThrows(IOException.class,
                () -> BakerSettings.loadConfig(tempDir.resolve("absent.yml"), null, null));
    }
}
