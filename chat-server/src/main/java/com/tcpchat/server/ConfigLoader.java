package com.tcpchat.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link ServerConfig} from JSON.
 *
 * Lookup order: an explicit file if one is given, otherwise the
 * {@value #DEFAULT_RESOURCE} classpath resource, otherwise the built-in
 * defaults. Command-line flags are applied on top by {@code Main}.
 *
 * The loader is thread-safe - ObjectMapper is thread-safe after configuration.
 */
public class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "chat-server.json";

    // ObjectMapper is thread-safe and should be reused
    private final ObjectMapper objectMapper;

    public ConfigLoader() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Loads the config from a file.
     *
     * @throws UncheckedIOException if the file cannot be read or parsed
     */
    public ServerConfig load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            ServerConfig config = objectMapper.readValue(in, ServerConfig.class);
            logger.info("Loaded configuration from {}", file);
            return config;
        } catch (IOException e) {
            logger.error("Failed to read configuration file {}", file, e);
            throw new UncheckedIOException("Cannot read configuration " + file, e);
        }
    }

    /**
     * Loads the config from a classpath resource, falling back to defaults
     * when the resource does not exist.
     *
     * @throws UncheckedIOException if the resource exists but cannot be parsed
     */
    public ServerConfig loadResource(String resource) {
        InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            logger.debug("No {} on the classpath, using defaults", resource);
            return new ServerConfig();
        }
        try (in) {
            return objectMapper.readValue(in, ServerConfig.class);
        } catch (IOException e) {
            logger.error("Failed to parse configuration resource {}", resource, e);
            throw new UncheckedIOException("Cannot parse configuration " + resource, e);
        }
    }

    /**
     * Parses a config from a JSON string.
     */
    public ServerConfig parse(String json) {
        try {
            return objectMapper.readValue(json, ServerConfig.class);
        } catch (IOException e) {
            logger.error("Failed to parse configuration: {}", json, e);
            throw new UncheckedIOException("Cannot parse configuration", e);
        }
    }
}
