package com.ryuqq.feed.core.spi;

import com.ryuqq.feed.core.cache.CacheStats;
import com.ryuqq.feed.core.model.CacheEntry;
import com.ryuqq.feed.core.model.CacheKey;
import com.ryuqq.feed.core.model.Endpoint;
import com.ryuqq.feed.core.model.HistoricalSnapshot;
import com.ryuqq.feed.core.model.Payload;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Tiered cache SPI used by the request orchestrator.
 *
 * <p>Reads fall through memory, file and history; the first tier that answers wins and
 * the entry is promoted to every faster tier. Stale entries are still returned so callers
 * can degrade gracefully. Only a key with no history at all yields an empty result.</p>
 *
 * <p><strong>Write path:</strong></p>
 * <pre>
 * put(key, endpoint, payload, eventTime)
 *   1. ttl = TtlPolicy.ttlFor(eventTime, now)
 *   2. memory tier write  (synchronous)
 *   3. file tier write    (synchronous)
 *   4. history append     (asynchronous, failures logged)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CacheStore {

    /**
     * Looks up the latest entry for the key.
     *
     * @param key the cache key
     * @return the entry tagged with the tier that answered, or empty on a total miss
     */
    Optional<CacheEntry> get(CacheKey key);

    /**
     * Stores a freshly fetched payload.
     *
     * @param key the cache key
     * @param endpoint the source endpoint
     * @param payload the response body
     * @param eventTime the related event time, or null when unknown
     * @return the stored entry
     */
    CacheEntry put(CacheKey key, Endpoint endpoint, Payload payload, Instant eventTime);

    /**
     * Checks staleness against the store clock.
     *
     * @param entry the entry
     * @return true if {@code now - fetchedAt > ttl}
     */
    boolean isStale(CacheEntry entry);

    /**
     * Current time according to the store clock.
     *
     * @return now
     */
    Instant now();

    /**
     * Drops the key from memory and file tiers. History is untouched.
     *
     * @param key the cache key
     */
    void invalidate(CacheKey key);

    /**
     * Empties the memory tier.
     */
    void clearMemory();

    /**
     * Deletes superseded file snapshots older than the given age.
     *
     * @param maxAge retention window
     * @return number of deleted snapshots
     */
    int purgeSnapshotsOlderThan(Duration maxAge);

    /**
     * Returns the historical record of the key since the given instant.
     *
     * @param key the cache key
     * @param since lower bound (inclusive)
     * @return chronologically ordered snapshots
     */
    List<HistoricalSnapshot> history(CacheKey key, Instant since);

    /**
     * Returns lookup statistics.
     *
     * @return a point-in-time snapshot
     */
    CacheStats stats();
}
