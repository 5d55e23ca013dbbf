package com.ryuqq.feed.adapter.inmemory.cache;

import com.ryuqq.feed.core.model.CacheEntry;
import com.ryuqq.feed.core.model.CacheKey;
import com.ryuqq.feed.core.model.CacheTier;
import com.ryuqq.feed.core.spi.CacheTierStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link CacheTierStore}, the fastest cache tier.
 *
 * <p>Holds the latest entry per key in a {@link ConcurrentHashMap}. Contents are lost on
 * process restart, after which the file tier answers and repopulates this tier.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>{@link ConcurrentHashMap#merge} keeps the most recently fetched entry per key, so a slower
 *       tier promoting an older copy never replaces a newer one; equal fetch times are last-write-wins</li>
 *   <li>No manual locking required</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryCacheTier implements CacheTierStore {

    /**
     * CacheKey → latest CacheEntry.
     */
    private final ConcurrentHashMap<CacheKey, CacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public CacheTier tier() {
        return CacheTier.MEMORY;
    }

    @Override
    public Optional<CacheEntry> read(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void write(CacheEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        entries.merge(entry.key(), entry.withTier(CacheTier.MEMORY),
            (current, incoming) -> incoming.fetchedAt().isBefore(current.fetchedAt()) ? current : incoming);
    }

    @Override
    public void invalidate(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        entries.remove(key);
    }

    @Override
    public void clear() {
        entries.clear();
    }

    /**
     * Returns the number of cached keys.
     *
     * <p>This method is useful for testing and debugging.</p>
     *
     * @return the number of keys
     */
    public int size() {
        return entries.size();
    }
}
