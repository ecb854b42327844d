package com.bytecache.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * CacheConfig loads and validates cache sizing from YAML.
 *
 * Configuration format:
 * <pre>
 * cache:
 *   limit: 40                 # byte budget
 *   generation_threshold: 8   # optional, defaults to limit / 5 (at least 1)
 *   generation_count: 2       # optional, defaults to 2
 * </pre>
 *
 * Immutable after loading. Invalid configuration fails on load with an
 * IllegalArgumentException listing every problem found.
 */
public class CacheConfig {
    private static final Logger logger = LoggerFactory.getLogger(CacheConfig.class);

    public static final int DEFAULT_GENERATION_COUNT = 2;
    public static final long GENERATION_THRESHOLD_DIVISOR = 5;

    private static final String ROOT_ELEMENT = "cache";

    private final long limit;
    private final long generationThreshold;
    private final int generationCount;

    /**
     * Constructor for Jackson deserialization.
     *
     * @param limit               Byte budget of the cache
     * @param generationThreshold Bytes per generation, or null for the default
     * @param generationCount     Number of sealed generations, or null for the default
     */
    @JsonCreator
    public CacheConfig(
            @JsonProperty(value = "limit", required = true) long limit,
            @JsonProperty("generation_threshold") Long generationThreshold,
            @JsonProperty("generation_count") Integer generationCount) {

        this.limit = limit;
        this.generationThreshold = generationThreshold != null
                ? generationThreshold
                : defaultGenerationThreshold(limit);
        this.generationCount = generationCount != null ? generationCount : DEFAULT_GENERATION_COUNT;

        validate();

        logger.debug("Cache configuration: limit={} bytes, generation threshold={} bytes, generation count={}",
                this.limit, this.generationThreshold, this.generationCount);
    }

    /**
     * Configuration with default generation sizing for the given limit.
     */
    public static CacheConfig withLimit(long limit) {
        return new CacheConfig(limit, null, null);
    }

    /**
     * Default bytes per generation: a fifth of the limit, at least 1.
     */
    public static long defaultGenerationThreshold(long limit) {
        return Math.max(1, limit / GENERATION_THRESHOLD_DIVISOR);
    }

    /**
     * Load cache configuration from a YAML file on the file system.
     *
     * @param configPath Path to YAML configuration file
     * @return Loaded and validated CacheConfig
     * @throws IOException              if file cannot be read
     * @throws IllegalArgumentException if configuration is invalid
     */
    public static CacheConfig load(String configPath) throws IOException {
        logger.info("Loading cache configuration from file: {}", configPath);

        File configFile = new File(configPath);
        if (!configFile.exists()) {
            throw new IOException("Configuration file not found: " + configPath);
        }

        if (!configFile.canRead()) {
            throw new IOException("Cannot read configuration file: " + configPath);
        }

        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        CacheConfig config = fromTree(mapper, mapper.readValue(configFile, Map.class));

        logger.info("Successfully loaded configuration from {}", configPath);
        return config;
    }

    /**
     * Load cache configuration from classpath resources.
     *
     * @param resourcePath Path to resource (e.g., "cache-config.yaml")
     * @return Loaded and validated CacheConfig
     * @throws IOException              if resource cannot be read
     * @throws IllegalArgumentException if configuration is invalid
     */
    public static CacheConfig loadFromClasspath(String resourcePath) throws IOException {
        logger.info("Loading cache configuration from classpath: {}", resourcePath);

        try (InputStream inputStream = CacheConfig.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Configuration resource not found in classpath: " + resourcePath);
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            CacheConfig config = fromTree(mapper, mapper.readValue(inputStream, Map.class));

            logger.info("Successfully loaded configuration from classpath resource");
            return config;
        }
    }

    private static CacheConfig fromTree(ObjectMapper mapper, Map<String, Object> wrapper) {
        if (wrapper == null || !wrapper.containsKey(ROOT_ELEMENT)) {
            throw new IllegalArgumentException("Configuration must contain '" + ROOT_ELEMENT + "' root element");
        }

        Object cacheData = wrapper.get(ROOT_ELEMENT);
        if (!(cacheData instanceof Map)) {
            throw new IllegalArgumentException(
                    "'" + ROOT_ELEMENT + "' must be a mapping with at least 'limit', got: " + cacheData);
        }
        return mapper.convertValue(cacheData, CacheConfig.class);
    }

    /**
     * Validate the loaded configuration.
     *
     * @throws IllegalArgumentException if validation fails
     */
    private void validate() {
        List<String> errors = new ArrayList<>();

        if (limit < 0) {
            errors.add("Limit must not be negative, got: " + limit);
        }

        if (generationThreshold < 1) {
            errors.add("Generation threshold must be at least 1, got: " + generationThreshold);
        }

        if (generationCount < 1) {
            errors.add("Generation count must be at least 1, got: " + generationCount);
        }

        if (limit > 0 && generationThreshold > limit) {
            logger.warn("Generation threshold ({}) is larger than the limit ({}). " +
                    "Keys will rarely age out before the cache runs out of memory.", generationThreshold, limit);
        }

        if (!errors.isEmpty()) {
            String errorMessage = "Cache configuration validation failed:\n" +
                    errors.stream()
                            .map(e -> "  - " + e)
                            .collect(Collectors.joining("\n"));
            throw new IllegalArgumentException(errorMessage);
        }
    }

    /**
     * @return Byte budget of the cache
     */
    public long getLimit() {
        return limit;
    }

    /**
     * @return Usage at which the open generation is sealed
     */
    public long getGenerationThreshold() {
        return generationThreshold;
    }

    /**
     * @return Number of sealed generations kept before keys become reclaimable
     */
    public int getGenerationCount() {
        return generationCount;
    }

    @Override
    public String toString() {
        return "CacheConfig{" +
                "limit=" + limit +
                ", generationThreshold=" + generationThreshold +
                ", generationCount=" + generationCount +
                '}';
    }
}
