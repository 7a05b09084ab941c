package org.nullmask.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.nullmask.options.NullMaskOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

public class ConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

    private static final String CONFIG_FILE_NAME = NullMaskOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = NullMaskOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = NullMaskOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final UnaryOperator<String> environment;

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    ConfigurationLoader(Path startDirectory, UnaryOperator<String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory.toAbsolutePath();
        this.environment = environment;
    }

    /**
     * Loads the configuration file and applies the selected profile.
     * <p>
     * Precedence: CLI profile > environment variable > default profile.
     *
     * @param cliProfile profile given on the command line, may be null
     * @return resolved settings keyed by {@link NullMaskOptions} keys
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<NullMaskConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile.trim();
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile.trim();
        }

        return DEFAULT_PROFILE;
    }

    /**
     * Walks from the start directory up to the filesystem root looking for nullmask.yaml.
     */
    private Optional<NullMaskConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    NullMaskConfiguration config = yamlMapper.readValue(configFile.toFile(), NullMaskConfiguration.class);
                    log.debug("Loaded configuration from {}", configFile);
                    return Optional.ofNullable(config);
                } catch (IOException e) {
                    log.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(NullMaskConfiguration config, String profile) {
        var profileConfig = config.getProfiles() == null ? null : config.getProfiles().get(profile);
        if (profileConfig == null) {
            log.warn("Profile '{}' not found in configuration. Using defaults.", profile);
            return createDefaultConfiguration();
        }

        var configMap = createDefaultConfiguration();
        var injection = profileConfig.getInjection();
        if (injection == null) {
            return configMap;
        }

        if (injection.getProbability() != null) {
            configMap.put(NullMaskOptions.Injection.PROBABILITY_KEY, String.valueOf(injection.getProbability()));
        }
        if (injection.getPattern() != null) {
            configMap.put(NullMaskOptions.Injection.PATTERN_KEY, injection.getPattern());
        }
        if (injection.getColumns() != null) {
            configMap.put(NullMaskOptions.Injection.COLUMNS_KEY, String.join(",", injection.getColumns()));
        }
        if (injection.getSeed() != null) {
            configMap.put(NullMaskOptions.Injection.SEED_KEY, String.valueOf(injection.getSeed()));
        }
        if (injection.getParallelism() != null) {
            configMap.put(NullMaskOptions.Injection.PARALLELISM_KEY, String.valueOf(injection.getParallelism()));
        }

        return configMap;
    }

    private Map<String, String> createDefaultConfiguration() {
        Map<String, String> defaults = new HashMap<>();
        defaults.put(NullMaskOptions.Injection.PROBABILITY_KEY,
                String.valueOf(NullMaskOptions.Injection.PROBABILITY_DEFAULT));
        defaults.put(NullMaskOptions.Injection.SEED_KEY,
                String.valueOf(NullMaskOptions.Injection.SEED_DEFAULT));
        defaults.put(NullMaskOptions.Injection.PARALLELISM_KEY,
                String.valueOf(NullMaskOptions.Injection.PARALLELISM_DEFAULT));
        return defaults;
    }
}
