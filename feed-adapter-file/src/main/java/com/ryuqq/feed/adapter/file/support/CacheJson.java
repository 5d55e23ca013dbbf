package com.ryuqq.feed.adapter.file.support;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson configuration for on-disk cache records.
 *
 * <p>Instants are written as ISO-8601 strings and unknown properties are ignored, so
 * records written by a newer version remain readable.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CacheJson {

    private CacheJson() {
    }

    /**
     * Creates a mapper for cache records.
     *
     * @return a new, independently configurable mapper
     */
    public static ObjectMapper newMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
