package io.github.shedder.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link ShedderConfig} as JSON. Durations are ISO-8601 strings ({@code "PT0.5S"}).
 *
 * <p>Usage:</p>
 * <pre>{@code
 * // From JSON string
 * ShedderConfig config = ConfigLoader.fromJson(jsonString);
 *
 * // From classpath
 * ShedderConfig config = ConfigLoader.fromResource("shedder.json");
 *
 * // To JSON
 * String json = ConfigLoader.toJson(config);
 * }</pre>
 */
public final class ConfigLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private ConfigLoader() {
    }

    /**
     * Load config from JSON string.
     *
     * @throws IllegalArgumentException if the JSON is malformed or an option is invalid
     */
    public static ShedderConfig fromJson(String json) {
        try {
            ShedderConfig config = MAPPER.readValue(json, ShedderConfig.class);
            if (config == null) {
                throw new IllegalArgumentException("Config JSON is empty");
            }
            return config;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid shedder config: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Load config from file.
     */
    public static ShedderConfig fromFile(Path path) throws IOException {
        return fromJson(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * Load config from input stream.
     */
    public static ShedderConfig fromStream(InputStream stream) throws IOException {
        return fromJson(new String(stream.readAllBytes(), StandardCharsets.UTF_8));
    }

    /**
     * Load config from classpath resource.
     */
    public static ShedderConfig fromResource(String resourcePath) throws IOException {
        try (InputStream stream = ConfigLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (stream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return fromStream(stream);
        }
    }

    /**
     * Convert config to JSON string. Disabled sections are omitted.
     */
    public static String toJson(ShedderConfig config) {
        try {
            return MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize shedder config", e);
        }
    }
}
