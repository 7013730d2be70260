package com.docvalidator.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading validator configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code docvalidator.yaml} into a {@link ValidationConfig} record.
 * If the config file is missing or invalid, returns {@link ValidationConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ValidationConfig config = ConfigLoader.load(Paths.get("docvalidator.yaml"));
 * int floor = config.minContentLength();
 * }</pre>
 */
public class ConfigLoader {

    /**
     * Default configuration file name.
     */
    public static final String DEFAULT_CONFIG_FILE = "docvalidator.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file found by convention.
     *
     * <p>A missing file is expected here and only logged at debug level.
     *
     * @param configPath path to {@code docvalidator.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ValidationConfig load(Path configPath) {
        return load(configPath, false);
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs and returns
     * {@link ValidationConfig#defaults()}. A missing file is logged as a warning when the path
     * was given explicitly.
     *
     * @param configPath path to the configuration file
     * @param explicit whether the user named this path
     * @return loaded configuration or defaults if unavailable
     */
    public static ValidationConfig load(Path configPath, boolean explicit) {
        if (!Files.exists(configPath)) {
            if (explicit) {
                log.warn("Configuration file not found: {}. Using defaults.", configPath);
            } else {
                log.debug("Configuration file not found: {}. Using defaults.", configPath);
            }
            return ValidationConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ValidationConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ValidationConfig config = YAML_MAPPER.readValue(configPath.toFile(), ValidationConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ValidationConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ValidationConfig.defaults();
        }
    }
}
