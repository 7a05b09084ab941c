package org.nullmask.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.nullmask.options.NullMaskOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationLoaderTest {

    private static final String YAML = """
            profiles:
              default:
                injection:
                  probability: 0.25
              dev:
                injection:
                  probability: 0.5
                  pattern: "^secret"
                  columns: [email, ssn]
                  seed: 42
                  parallelism: 4
              empty: {}
            """;

    @Test
    @DisplayName("returns defaults when no configuration file exists")
    void loadConfiguration_noFile_returnsDefaults(@TempDir Path tempDir) {
        // given
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        // when
        Map<String, String> config = loader.loadConfiguration("dev");

        // then
        assertEquals(String.valueOf(NullMaskOptions.Injection.PROBABILITY_DEFAULT),
                config.get(NullMaskOptions.Injection.PROBABILITY_KEY));
        assertEquals(String.valueOf(NullMaskOptions.Injection.SEED_DEFAULT),
                config.get(NullMaskOptions.Injection.SEED_KEY));
        assertNull(config.get(NullMaskOptions.Injection.PATTERN_KEY));
        assertNull(config.get(NullMaskOptions.Injection.COLUMNS_KEY));
    }

    @Test
    @DisplayName("loads every injection value of the requested profile")
    void loadConfiguration_withProfile_loadsAllValues(@TempDir Path tempDir) throws IOException {
        // given
        Files.writeString(tempDir.resolve("nullmask.yaml"), YAML);
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        // when
        Map<String, String> config = loader.loadConfiguration("dev");

        // then
        assertEquals("0.5", config.get(NullMaskOptions.Injection.PROBABILITY_KEY));
        assertEquals("^secret", config.get(NullMaskOptions.Injection.PATTERN_KEY));
        assertEquals("email,ssn", config.get(NullMaskOptions.Injection.COLUMNS_KEY));
        assertEquals("42", config.get(NullMaskOptions.Injection.SEED_KEY));
        assertEquals("4", config.get(NullMaskOptions.Injection.PARALLELISM_KEY));
    }

    @Test
    @DisplayName("uses the default profile when none is given")
    void loadConfiguration_noProfile_usesDefaultProfile(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("nullmask.yaml"), YAML);
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        Map<String, String> config = loader.loadConfiguration(null);

        assertEquals("0.25", config.get(NullMaskOptions.Injection.PROBABILITY_KEY));
    }

    @Test
    @DisplayName("environment variable selects the profile when the CLI gives none")
    void loadConfiguration_envVariable_usesCorrectProfile(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("nullmask.yaml"), YAML);
        Map<String, String> env = Map.of(NullMaskOptions.Profile.ENV_VAR, "dev");
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, env::get);

        assertEquals("0.5", loader.loadConfiguration(null).get(NullMaskOptions.Injection.PROBABILITY_KEY));
        assertEquals("0.25", loader.loadConfiguration("default").get(NullMaskOptions.Injection.PROBABILITY_KEY));
    }

    @Test
    @DisplayName("unknown or empty profile falls back to defaults")
    void loadConfiguration_nonExistentProfile_returnsDefaults(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("nullmask.yaml"), YAML);
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        assertEquals(String.valueOf(NullMaskOptions.Injection.PROBABILITY_DEFAULT),
                loader.loadConfiguration("nonexistent").get(NullMaskOptions.Injection.PROBABILITY_KEY));
        assertEquals(String.valueOf(NullMaskOptions.Injection.PROBABILITY_DEFAULT),
                loader.loadConfiguration("empty").get(NullMaskOptions.Injection.PROBABILITY_KEY));
    }

    @Test
    @DisplayName("finds the configuration file in a parent directory")
    void loadConfiguration_searchesParents(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("nullmask.yaml"), YAML);
        Path nested = Files.createDirectories(tempDir.resolve("a/b/c"));
        ConfigurationLoader loader = new ConfigurationLoader(nested, name -> null);

        assertEquals("42", loader.loadConfiguration("dev").get(NullMaskOptions.Injection.SEED_KEY));
    }

    @Test
    @DisplayName("malformed file is ignored and defaults are used")
    void loadConfiguration_malformedFile_returnsDefaults(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("nullmask.yaml"), "profiles: [not, a, map");
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        assertEquals(String.valueOf(NullMaskOptions.Injection.PROBABILITY_DEFAULT),
                loader.loadConfiguration("dev").get(NullMaskOptions.Injection.PROBABILITY_KEY));
    }
}
