package com.stencil.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading Stencil configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code stencil.yaml} into {@link CompilerConfig}.
 * If the config file is missing or invalid, returns {@link CompilerConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CompilerConfig config = ConfigLoader.load(Paths.get("stencil.yaml"));
 * String generatorName = config.generator().name();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link CompilerConfig#defaults()}.
     *
     * @param configPath path to {@code stencil.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static CompilerConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return CompilerConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return CompilerConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            CompilerConfig config = YAML_MAPPER.readValue(configPath.toFile(), CompilerConfig.class);
            if (config == null) {
                // Empty document
                return CompilerConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return CompilerConfig.defaults();
        }
    }
}
