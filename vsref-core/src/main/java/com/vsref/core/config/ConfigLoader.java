package com.vsref.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading resolver configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code vsref.yaml} into {@link ResolverConfig} records.
 * If the config file is missing or invalid, returns {@link ResolverConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ResolverConfig config = ConfigLoader.load(Paths.get("vsref.yaml"));
 *
 * if (config.resolve().cascade()) {
 *     // Load project files too
 * }
 * }</pre>
 */
public class ConfigLoader {

    public static final String DEFAULT_CONFIG_FILE = "vsref.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link ResolverConfig#defaults()}.
     *
     * @param configPath path to {@code vsref.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ResolverConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return ResolverConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ResolverConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ResolverConfig config = YAML_MAPPER.readValue(configPath.toFile(), ResolverConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ResolverConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ResolverConfig.defaults();
        }
    }
}
