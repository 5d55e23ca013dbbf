package com.ryuqq.feed.core.spi;

import com.ryuqq.feed.core.model.CacheEntry;
import com.ryuqq.feed.core.model.CacheKey;
import com.ryuqq.feed.core.model.CacheTier;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage SPI for a single cache tier.
 *
 * <p>A tier stores the latest {@link CacheEntry} per key. Tiers are composed by
 * {@link CacheStore} implementations in order of speed (memory, then file).</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: concurrent reads and writes for different keys</li>
 *   <li>Last write wins: {@link #write(CacheEntry)} replaces the previous entry for the key</li>
 *   <li>A stored record that cannot be decoded raises
 *       {@link com.ryuqq.feed.core.exception.CacheCorruptException}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CacheTierStore {

    /**
     * Returns the tier this store represents.
     *
     * @return the tier
     */
    CacheTier tier();

    /**
     * Reads the latest entry for the key.
     *
     * @param key the cache key
     * @return the entry tagged with this tier, or empty if the key was never written
     * @throws com.ryuqq.feed.core.exception.CacheCorruptException if the stored record is unreadable
     */
    Optional<CacheEntry> read(CacheKey key);

    /**
     * Writes the entry as the latest value for its key.
     *
     * @param entry the entry to store
     * @throws IllegalArgumentException if entry is null
     */
    void write(CacheEntry entry);

    /**
     * Drops the latest value for the key.
     *
     * @param key the cache key
     */
    void invalidate(CacheKey key);

    /**
     * Drops every value held by this tier.
     */
    void clear();

    /**
     * Deletes superseded records written before the cutoff.
     *
     * <p>The latest record of each key is never deleted. Tiers without retention return 0.</p>
     *
     * @param cutoff records fetched before this instant are eligible
     * @return number of deleted records
     */
    default int purgeOlderThan(Instant cutoff) {
        return 0;
    }
}
