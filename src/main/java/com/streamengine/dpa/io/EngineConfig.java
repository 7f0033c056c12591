package com.streamengine.dpa.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * Engine settings, bound from {@code stream-engine.json} on the classpath.
 * Keys that are absent keep their defaults.
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineConfig {
    public static final String DEFAULT_RESOURCE = "stream-engine.json";

    /** Upper bound on waiting for all raw fetches of one request. */
    private long fetchTimeoutMillis = 30_000;

    /** Worker threads of the in-memory raw store. */
    private int fetchThreads = 4;

    /** Classpath location of the parameter catalog. */
    private String catalogResource = "catalog/catalog.json";

    public static EngineConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    /** Reads a classpath resource, or returns defaults if there is none. */
    public static EngineConfig load(String resource) {
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.info("No {} on the classpath, using defaults", resource);
                return new EngineConfig();
            }
            EngineConfig config = new ObjectMapper().readValue(in, EngineConfig.class);
            log.info("Loaded {}: {}", resource, config);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }
}
