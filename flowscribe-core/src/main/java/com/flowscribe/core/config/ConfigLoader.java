package com.flowscribe.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading FlowScribe configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code flowscribe.yaml} into {@link FlowScribeConfig}.
 * If the config file is missing or invalid, returns {@link FlowScribeConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * FlowScribeConfig config = ConfigLoader.load(Paths.get("flowscribe.yaml"));
 * int cap = config.traversal().maxRevisits();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Default configuration file name. */
    public static final String DEFAULT_FILE_NAME = "flowscribe.yaml";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist, can't be read or can't be parsed, logs a warning and
     * returns {@link FlowScribeConfig#defaults()}.
     *
     * @param configPath path to {@code flowscribe.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static FlowScribeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return FlowScribeConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return FlowScribeConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            FlowScribeConfig config = YAML_MAPPER.readValue(configPath.toFile(), FlowScribeConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return FlowScribeConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return FlowScribeConfig.defaults();
        }
    }
}
