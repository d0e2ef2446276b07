package com.testbatch.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@code testbatch.yaml} into a {@link HarnessConfig}.
 *
 * <p>Loading never fails: a missing, unreadable or invalid file is logged and replaced by
 * {@link HarnessConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * HarnessConfig config = ConfigLoader.load(Paths.get("testbatch.yaml"));
 * TestRegistry registry = new TestRegistry(System.out, config.reportSettings());
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = "testbatch.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code testbatch.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static HarnessConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return HarnessConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return HarnessConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            HarnessConfig config = YAML_MAPPER.readValue(configPath.toFile(), HarnessConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return HarnessConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return HarnessConfig.defaults();
        }
    }
}
