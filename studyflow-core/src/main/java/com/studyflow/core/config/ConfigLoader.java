package com.studyflow.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading engine configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code studyflow.yaml} into {@link StudyFlowConfig} records.
 * If the config file is missing or invalid, returns {@link StudyFlowConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * StudyFlowConfig config = ConfigLoader.load(Paths.get("studyflow.yaml"));
 * ProcedureMapper mapper = new ProcedureMapper(catalog, config.mapping());
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
     * {@link StudyFlowConfig#defaults()}.
     *
     * @param configPath path to {@code studyflow.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static StudyFlowConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using default thresholds.", configPath);
            return StudyFlowConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return StudyFlowConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            StudyFlowConfig config = YAML_MAPPER.readValue(configPath.toFile(), StudyFlowConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return StudyFlowConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return StudyFlowConfig.defaults();
        }
    }
}
