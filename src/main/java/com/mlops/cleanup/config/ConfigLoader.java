package com.mlops.cleanup.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Loads cleanup configuration from YAML files. Every failure is fatal.
 */
@Slf4j
public class ConfigLoader {

    public static final String DEFAULT_CONFIG = "cleanup-config.yaml";

    private final ObjectMapper yamlMapper;

    public ConfigLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.yamlMapper.enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    /**
     * Load configuration from the default classpath resource
     */
    public CleanupConfig loadDefault() throws BaselineConfigException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG)) {
            if (is == null) {
                throw new BaselineConfigException("Default config '" + DEFAULT_CONFIG + "' not found on classpath");
            }
            CleanupConfig config = read(yamlMapper.readValue(is, CleanupConfig.class), "classpath:" + DEFAULT_CONFIG);
            log.info("Loaded default cleanup config from classpath");
            return config;
        } catch (IOException e) {
            throw new BaselineConfigException("Failed to parse default config: " + e.getMessage(), e);
        }
    }

    /**
     * Load configuration from a specific file path
     */
    public CleanupConfig loadFromFile(String filePath) throws BaselineConfigException {
        File configFile = new File(filePath);
        if (!configFile.isFile()) {
            throw new BaselineConfigException("Config file not found: " + filePath);
        }
        try {
            CleanupConfig config = read(yamlMapper.readValue(configFile, CleanupConfig.class), filePath);
            log.info("Loaded cleanup config from '{}'", filePath);
            return config;
        } catch (IOException e) {
            throw new BaselineConfigException("Failed to parse config file " + filePath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load configuration from file path, or use default file in current directory,
     * or fall back to the classpath default.
     */
    public CleanupConfig load(String filePath) throws BaselineConfigException {
        if (filePath == null || filePath.isEmpty()) {
            if (Files.exists(Paths.get(DEFAULT_CONFIG))) {
                log.info("Loading config from current directory: {}", DEFAULT_CONFIG);
                return loadFromFile(DEFAULT_CONFIG);
            }
            log.info("No config file in current directory, using default from classpath");
            return loadDefault();
        }
        return loadFromFile(filePath);
    }

    private CleanupConfig read(CleanupConfig config, String source) throws BaselineConfigException {
        if (config == null) {
            throw new BaselineConfigException("Config " + source + " is empty");
        }
        if (config.getBaseline() == null || config.getExecution() == null || config.getPolicy() == null) {
            throw new BaselineConfigException("Config " + source + " has an empty section");
        }
        CleanupConfig.Execution execution = config.getExecution();
        if (execution.getWorkers() < 1 || execution.getScanWorkers() < 1 || execution.getPageSize() < 1) {
            throw new BaselineConfigException("Config " + source + ": workers, scanWorkers and pageSize must be positive");
        }
        if (execution.getPodTimeoutSeconds() < 1 || execution.getJobTimeoutSeconds() < 1
                || execution.getNamespaceTimeoutSeconds() < 1 || execution.getDefaultTimeoutSeconds() < 1) {
            throw new BaselineConfigException("Config " + source + ": timeouts must be positive");
        }
        if (config.getPolicy().getTerminalRetentionSeconds() < 0) {
            throw new BaselineConfigException("Config " + source + ": terminalRetentionSeconds must not be negative");
        }
        return config;
    }
}
