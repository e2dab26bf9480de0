package com.mathtex.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading MathTeX configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code mathtex.yaml} into {@link MathTexConfig} records.
 * If the config file is missing or invalid, returns {@link MathTexConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * MathTexConfig config = ConfigLoader.load(Paths.get("mathtex.yaml"));
 * SymbolTable symbols = config.symbolTable(Paths.get("."));
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
     * {@link MathTexConfig#defaults()}.
     *
     * @param configPath path to {@code mathtex.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static MathTexConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return MathTexConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return MathTexConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            MathTexConfig config = YAML_MAPPER.readValue(configPath.toFile(), MathTexConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return MathTexConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return MathTexConfig.defaults();
        }
    }
}
