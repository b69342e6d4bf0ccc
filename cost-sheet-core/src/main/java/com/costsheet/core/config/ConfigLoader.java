package com.costsheet.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link CostSheetConfig} from {@code costsheet.yaml}.
 *
 * <p>Never throws: a missing, unreadable or invalid file yields
 * {@link CostSheetConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CostSheetConfig config = ConfigLoader.load(Path.of("costsheet.yaml"));
 * if (config.featureFlags().isEnabled("fire-suppression")) {
 *     // fire suppression sheets are produced
 * }
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = "costsheet.yaml";

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code costsheet.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static CostSheetConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return CostSheetConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return CostSheetConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            CostSheetConfig config = YAML_MAPPER.readValue(configPath.toFile(), CostSheetConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return CostSheetConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return CostSheetConfig.defaults();
        }
    }
}
