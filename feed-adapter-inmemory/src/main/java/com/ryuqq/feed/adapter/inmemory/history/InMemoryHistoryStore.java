package com.ryuqq.feed.adapter.inmemory.history;

import com.ryuqq.feed.core.model.CacheKey;
import com.ryuqq.feed.core.model.HistoricalSnapshot;
import com.ryuqq.feed.core.spi.HistoryStore;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link HistoryStore} for testing and reference purposes.
 *
 * <p>Snapshots are kept per key in a {@link CopyOnWriteArrayList}, in append order.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryHistoryStore implements HistoryStore {

    private final ConcurrentHashMap<CacheKey, CopyOnWriteArrayList<HistoricalSnapshot>> history =
        new ConcurrentHashMap<>();

    @Override
    public void append(HistoricalSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        history.computeIfAbsent(snapshot.key(), k -> new CopyOnWriteArrayList<>()).add(snapshot);
    }

    @Override
    public List<HistoricalSnapshot> snapshots(CacheKey key, Instant since) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (since == null) {
            throw new IllegalArgumentException("since cannot be null");
        }
        return history.getOrDefault(key, new CopyOnWriteArrayList<>()).stream()
            .filter(snapshot -> !snapshot.fetchTimestamp().isBefore(since))
            .sorted(Comparator.comparing(HistoricalSnapshot::fetchTimestamp))
            .collect(Collectors.toList());
    }

    @Override
    public Optional<HistoricalSnapshot> latest(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return history.getOrDefault(key, new CopyOnWriteArrayList<>()).stream()
            .max(Comparator.comparing(HistoricalSnapshot::fetchTimestamp));
    }

    /**
     * Returns the total number of stored snapshots.
     *
     * <p>This method is useful for testing and debugging.</p>
     *
     * @return the number of snapshots across all keys
     */
    public int size() {
        return history.values().stream().mapToInt(List::size).sum();
    }
}
