package com.ryuqq.feed.application.cache;

import com.ryuqq.feed.core.cache.CacheStats;
import com.ryuqq.feed.core.cache.TtlPolicy;
import com.ryuqq.feed.core.exception.CacheCorruptException;
import com.ryuqq.feed.core.model.CacheEntry;
import com.ryuqq.feed.core.model.CacheKey;
import com.ryuqq.feed.core.model.CacheTier;
import com.ryuqq.feed.core.model.Endpoint;
import com.ryuqq.feed.core.model.HistoricalSnapshot;
import com.ryuqq.feed.core.model.Payload;
import com.ryuqq.feed.core.spi.CacheStore;
import com.ryuqq.feed.core.spi.CacheTierStore;
import com.ryuqq.feed.core.spi.HistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * 계층형 캐시 저장소.
 *
 * <p>빠른 계층부터 순서대로 조회하며, 느린 계층에서 적중하면 그보다 빠른 모든 계층으로 승격합니다.
 * 모든 계층이 비어 있으면 이력 기록의 최신 스냅샷을 마지막 수단으로 사용합니다.</p>
 *
 * <p><strong>조회 순서:</strong></p>
 * <pre>
 * tiers[0] (MEMORY) → tiers[1] (FILE) → HistoryStore.latest (HISTORY) → miss
 * </pre>
 *
 * <p><strong>장애 처리:</strong></p>
 * <ul>
 *   <li>계층 조회 중 {@link CacheCorruptException} 또는 I/O 실패 → 경고 로그 후 해당 계층 miss</li>
 *   <li>파일 계층 쓰기 실패 → 에러 로그, 메모리 계층 값은 유지</li>
 *   <li>이력 추가는 전용 단일 스레드에서 비동기로 실행, 실패는 로그만 남김</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> 계층 구현이 스레드 안전하면 이 클래스도 스레드 안전합니다.
 * 통계는 {@link LongAdder} 로 집계합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TieredCacheStore implements CacheStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TieredCacheStore.class);

    private final List<CacheTierStore> tiers;
    private final HistoryStore history;
    private final TtlPolicy ttlPolicy;
    private final Clock clock;
    private final Executor historyWriter;
    private final ExecutorService ownedHistoryWriter;

    private final LongAdder lookups = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final Map<CacheTier, LongAdder> hits = new EnumMap<>(CacheTier.class);

    /**
     * 전용 이력 기록 스레드를 생성하는 생성자.
     *
     * @param tiers 빠른 순서의 계층 목록
     * @param history 이력 기록
     * @param ttlPolicy TTL 정책
     * @param clock 시간 소스
     */
    public TieredCacheStore(List<CacheTierStore> tiers, HistoryStore history, TtlPolicy ttlPolicy, Clock clock) {
        this(tiers, history, ttlPolicy, clock, newHistoryWriter());
    }

    /**
     * 이력 기록 Executor 를 주입하는 생성자.
     *
     * <p>주입된 Executor 의 생명주기는 호출자가 관리합니다. 테스트에서는 {@code Runnable::run} 으로
     * 동기 실행할 수 있습니다.</p>
     *
     * @param tiers 빠른 순서의 계층 목록
     * @param history 이력 기록
     * @param ttlPolicy TTL 정책
     * @param clock 시간 소스
     * @param historyWriter 이력 추가를 실행할 Executor
     * @throws IllegalArgumentException 인자가 null 이거나 tiers 가 비어 있는 경우
     */
    public TieredCacheStore(
        List<CacheTierStore> tiers,
        HistoryStore history,
        TtlPolicy ttlPolicy,
        Clock clock,
        Executor historyWriter
    ) {
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("tiers cannot be null or empty");
        }
        if (history == null) {
            throw new IllegalArgumentException("history cannot be null");
        }
        if (ttlPolicy == null) {
            throw new IllegalArgumentException("ttlPolicy cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (historyWriter == null) {
            throw new IllegalArgumentException("historyWriter cannot be null");
        }
        this.tiers = List.copyOf(tiers);
        this.history = history;
        this.ttlPolicy = ttlPolicy;
        this.clock = clock;
        this.historyWriter = historyWriter;
        this.ownedHistoryWriter = historyWriter instanceof ExecutorService ? (ExecutorService) historyWriter : null;
        for (CacheTier tier : CacheTier.values()) {
            hits.put(tier, new LongAdder());
        }
    }

    private static ExecutorService newHistoryWriter() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "feed-history-writer");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public Optional<CacheEntry> get(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        lookups.increment();

        for (int i = 0; i < tiers.size(); i++) {
            CacheTierStore tier = tiers.get(i);
            Optional<CacheEntry> found = readTier(tier, key);
            if (found.isPresent()) {
                CacheEntry entry = found.get().withTier(tier.tier());
                promote(entry, i);
                hits.get(tier.tier()).increment();
                log.debug("Cache hit key={} tier={}", key.getValue(), tier.tier());
                return Optional.of(entry);
            }
        }

        Optional<CacheEntry> fromHistory = readHistory(key);
        if (fromHistory.isPresent()) {
            promote(fromHistory.get(), tiers.size());
            hits.get(CacheTier.HISTORY).increment();
            log.debug("Cache hit key={} tier={}", key.getValue(), CacheTier.HISTORY);
            return fromHistory;
        }

        misses.increment();
        return Optional.empty();
    }

    @Override
    public CacheEntry put(CacheKey key, Endpoint endpoint, Payload payload, Instant eventTime) {
        Instant now = clock.instant();
        Duration ttl = ttlPolicy.ttlFor(eventTime, now);
        CacheEntry entry = new CacheEntry(key, endpoint, payload, now, ttl, CacheTier.LIVE, eventTime);

        for (CacheTierStore tier : tiers) {
            writeTier(tier, entry);
        }
        appendHistory(HistoricalSnapshot.of(entry));
        return entry;
    }

    @Override
    public boolean isStale(CacheEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        return entry.isStaleAt(clock.instant());
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    @Override
    public void invalidate(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        for (CacheTierStore tier : tiers) {
            try {
                tier.invalidate(key);
            } catch (UncheckedIOException e) {
                log.error("Failed to invalidate key={} in tier={}", key.getValue(), tier.tier(), e);
            }
        }
    }

    @Override
    public void clearMemory() {
        for (CacheTierStore tier : tiers) {
            if (tier.tier() == CacheTier.MEMORY) {
                tier.clear();
            }
        }
        log.info("Memory cache cleared");
    }

    @Override
    public int purgeSnapshotsOlderThan(Duration maxAge) {
        if (maxAge == null || maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge cannot be null or negative (current: " + maxAge + ")");
        }
        Instant cutoff = clock.instant().minus(maxAge);
        int purged = 0;
        for (CacheTierStore tier : tiers) {
            purged += tier.purgeOlderThan(cutoff);
        }
        return purged;
    }

    @Override
    public List<HistoricalSnapshot> history(CacheKey key, Instant since) {
        return history.snapshots(key, since);
    }

    @Override
    public CacheStats stats() {
        Map<CacheTier, Long> hitsByTier = new EnumMap<>(CacheTier.class);
        hits.forEach((tier, counter) -> hitsByTier.put(tier, counter.sum()));
        return new CacheStats(lookups.sum(), misses.sum(), hitsByTier);
    }

    /**
     * 내부에서 생성한 이력 기록 스레드를 종료합니다.
     *
     * <p>대기 중인 이력 추가가 끝날 때까지 최대 10초 기다립니다.</p>
     */
    @Override
    public void close() {
        if (ownedHistoryWriter == null) {
            return;
        }
        ownedHistoryWriter.shutdown();
        try {
            if (!ownedHistoryWriter.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("History writer did not drain within 10s, dropping pending appends");
                ownedHistoryWriter.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedHistoryWriter.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private Optional<CacheEntry> readTier(CacheTierStore tier, CacheKey key) {
        try {
            return tier.read(key);
        } catch (CacheCorruptException e) {
            log.warn("Corrupt cache record for key={} in tier={} at {}, treating as miss",
                key.getValue(), tier.tier(), e.getLocation(), e);
            return Optional.empty();
        } catch (UncheckedIOException e) {
            log.warn("Failed to read key={} from tier={}, treating as miss", key.getValue(), tier.tier(), e);
            return Optional.empty();
        }
    }

    private Optional<CacheEntry> readHistory(CacheKey key) {
        Optional<HistoricalSnapshot> latest;
        try {
            latest = history.latest(key);
        } catch (CacheCorruptException e) {
            log.warn("Corrupt history for key={} at {}, treating as miss", key.getValue(), e.getLocation(), e);
            return Optional.empty();
        } catch (UncheckedIOException e) {
            log.warn("Failed to read history for key={}, treating as miss", key.getValue(), e);
            return Optional.empty();
        }
        return latest.map(snapshot -> new CacheEntry(
            snapshot.key(),
            snapshot.providerEndpoint(),
            snapshot.payload(),
            snapshot.fetchTimestamp(),
            ttlPolicy.ttlFor(snapshot.eventTime(), snapshot.fetchTimestamp()),
            CacheTier.HISTORY,
            snapshot.eventTime()
        ));
    }

    private void promote(CacheEntry entry, int answeringIndex) {
        for (int i = 0; i < answeringIndex; i++) {
            writeTier(tiers.get(i), entry);
        }
    }

    private void writeTier(CacheTierStore tier, CacheEntry entry) {
        try {
            tier.write(entry);
        } catch (UncheckedIOException e) {
            log.error("Failed to write key={} to tier={}", entry.key().getValue(), tier.tier(), e);
        }
    }

    private void appendHistory(HistoricalSnapshot snapshot) {
        try {
            historyWriter.execute(() -> {
                try {
                    history.append(snapshot);
                } catch (RuntimeException e) {
                    log.error("Failed to append history for key={}", snapshot.key().getValue(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("History writer rejected snapshot for key={}, it will be missing from history",
                snapshot.key().getValue(), e);
        }
    }
}
