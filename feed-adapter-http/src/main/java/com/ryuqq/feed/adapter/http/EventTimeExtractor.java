package com.ryuqq.feed.adapter.http;

import com.ryuqq.feed.core.model.Payload;

import java.time.Instant;
import java.util.Optional;

/**
 * Derives the time of the real-world event a response describes.
 *
 * <p>The result drives the cache TTL: the closer the event, the shorter the TTL.
 * Implementations must not throw on payloads they cannot interpret; they return empty instead.</p>
 */
@FunctionalInterface
public interface EventTimeExtractor {

    /**
     * @param payload response body
     * @param now current time, used to pick between several candidate times
     * @return the event time, or empty when the payload carries none
     */
    Optional<Instant> extract(Payload payload, Instant now);

    static EventTimeExtractor none() {
        return (payload, now) -> Optional.empty();
    }
}
