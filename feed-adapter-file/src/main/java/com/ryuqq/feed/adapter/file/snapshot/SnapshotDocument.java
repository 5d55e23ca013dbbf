package com.ryuqq.feed.adapter.file.snapshot;

import com.ryuqq.feed.core.model.CacheEntry;
import com.ryuqq.feed.core.model.CacheKey;
import com.ryuqq.feed.core.model.CacheTier;
import com.ryuqq.feed.core.model.Endpoint;
import com.ryuqq.feed.core.model.Payload;

import java.time.Duration;
import java.time.Instant;

/**
 * JSON document of one snapshot file.
 *
 * <p>The payload is written as base64 by Jackson's default {@code byte[]} handling.</p>
 *
 * @param key cache key
 * @param endpoint source endpoint
 * @param fetchedAt fetch instant
 * @param ttlSeconds TTL computed when the entry was stored
 * @param eventTime related event time, may be null
 * @param payload response body
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SnapshotDocument(
    String key,
    String endpoint,
    Instant fetchedAt,
    long ttlSeconds,
    Instant eventTime,
    byte[] payload
) {

    static SnapshotDocument from(CacheEntry entry) {
        return new SnapshotDocument(
            entry.key().getValue(),
            entry.endpoint().getValue(),
            entry.fetchedAt(),
            entry.ttl().getSeconds(),
            entry.eventTime(),
            entry.payload().toByteArray()
        );
    }

    CacheEntry toEntry() {
        return new CacheEntry(
            CacheKey.of(key),
            Endpoint.of(endpoint),
            Payload.of(payload),
            fetchedAt,
            Duration.ofSeconds(ttlSeconds),
            CacheTier.FILE,
            eventTime
        );
    }
}
