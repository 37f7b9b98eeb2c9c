package com.pairstream.server.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Locates the pipeline settings: the file named by the {@code pairstream.config} system
 * property, then {@code /pipeline_config.json} on the classpath, then built-in defaults.
 */
public class SettingsResolver {

    private static final Logger logger = LoggerFactory.getLogger(SettingsResolver.class);

    public static final String CONFIG_PROPERTY = "pairstream.config";
    public static final String CLASSPATH_CONFIG = "/pipeline_config.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static PipelineSettings resolve() throws IOException {
        // 1. System property
        String sysProp = System.getProperty(CONFIG_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return load(Paths.get(sysProp));
        }

        // 2. Classpath
        try (InputStream is = SettingsResolver.class.getResourceAsStream(CLASSPATH_CONFIG)) {
            if (is != null) {
                logger.info("Loading pipeline settings from classpath {}", CLASSPATH_CONFIG);
                return MAPPER.readValue(is, PipelineSettings.class);
            }
        }

        // 3. Defaults
        logger.warn("No pipeline settings found; using defaults");
        return new PipelineSettings();
    }

    public static PipelineSettings load(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Pipeline settings file not found: " + file.toAbsolutePath());
        }
        logger.info("Loading pipeline settings from {}", file.toAbsolutePath());
        try (InputStream is = Files.newInputStream(file)) {
            return MAPPER.readValue(is, PipelineSettings.class);
        }
    }

    public static PipelineSettings parse(String json) throws IOException {
        return MAPPER.readValue(json, PipelineSettings.class);
    }
}
