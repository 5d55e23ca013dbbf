package com.ryuqq.feed.core.spi;

import com.ryuqq.feed.core.model.CacheKey;
import com.ryuqq.feed.core.model.HistoricalSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only historical record SPI.
 *
 * <p>Every successful live fetch is appended once. Rows are never updated or deleted,
 * so the record answers trend queries (line movement, closing line value) and serves
 * as the last-resort read tier when memory and file tiers are empty.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe appends</li>
 *   <li>{@link #snapshots(CacheKey, Instant)} returns rows in chronological order</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface HistoryStore {

    /**
     * Appends a snapshot.
     *
     * @param snapshot the snapshot to append
     * @throws IllegalArgumentException if snapshot is null
     */
    void append(HistoricalSnapshot snapshot);

    /**
     * Returns all snapshots of the key fetched at or after {@code since}.
     *
     * @param key the cache key
     * @param since lower bound (inclusive)
     * @return chronologically ordered snapshots, empty if none
     */
    List<HistoricalSnapshot> snapshots(CacheKey key, Instant since);

    /**
     * Returns the most recent snapshot of the key.
     *
     * @param key the cache key
     * @return the newest snapshot, or empty if the key has no history
     * @throws com.ryuqq.feed.core.exception.CacheCorruptException if a row cannot be decoded
     */
    Optional<HistoricalSnapshot> latest(CacheKey key);
}
