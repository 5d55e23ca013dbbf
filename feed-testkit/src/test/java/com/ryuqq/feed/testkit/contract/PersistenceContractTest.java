package com.ryuqq.feed.testkit.contract;

import com.ryuqq.feed.adapter.file.history.JsonLinesHistoryStore;
import com.ryuqq.feed.adapter.file.snapshot.FileSnapshotTier;
import com.ryuqq.feed.core.model.CacheKey;
import com.ryuqq.feed.core.model.CacheTier;
import com.ryuqq.feed.core.model.Degradation;
import com.ryuqq.feed.core.model.Endpoint;
import com.ryuqq.feed.core.model.FetchResult;
import com.ryuqq.feed.core.spi.CacheTierStore;
import com.ryuqq.feed.core.spi.HistoryStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for cached data surviving a process restart.
 *
 * <p>The pipeline runs with a file snapshot tier and a JSON lines history store under a temporary
 * directory. {@link #restart()} drops everything held in memory.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class PersistenceContractTest extends AbstractContractTest {

    private static final String WEATHER = "noaa_api/points";

    @TempDir
    Path dataDir;

    @Override
    protected List<CacheTierStore> persistentTiers() {
        return List.of(new FileSnapshotTier(dataDir.resolve("snapshots")));
    }

    @Override
    protected HistoryStore historyStore() {
        return new JsonLinesHistoryStore(dataDir.resolve("history"));
    }

    @Test
    void testRestart_FreshSnapshot_ServedFromFileThenMemory() {
        // Given
        upstream.respond(WEATHER, "{\"temp\":70}");
        assertLive(fetch(WEATHER));

        // When
        restart();
        FetchResult afterRestart = fetch(WEATHER);
        FetchResult promoted = fetch(WEATHER);

        // Then
        assertFreshFrom(afterRestart, CacheTier.FILE);
        assertEquals("{\"temp\":70}", afterRestart.payload().asUtf8());
        assertFreshFrom(promoted, CacheTier.MEMORY);
        assertEquals(1, upstream.callCount(), "No network call should be needed after restart");
    }

    @Test
    void testRestart_UpstreamDown_ServesExpiredSnapshot() {
        // Given
        upstream.respond(WEATHER, "{\"temp\":70}");
        assertLive(fetch(WEATHER));
        restart();
        clock.advance(Duration.ofMinutes(90));
        upstream.failWith(WEATHER, 502);

        // When
        FetchResult result = fetch(WEATHER);

        // Then
        assertStale(result, Degradation.UPSTREAM_FAILED);
        assertEquals(CacheTier.FILE, result.tier());
        assertEquals(Duration.ofMinutes(90), result.age());
    }

    @Test
    void testRestart_SnapshotLost_FallsBackToHistory() {
        // Given: two fetches recorded in history, then the snapshots disappear
        upstream.respond(WEATHER, "{\"temp\":70}");
        assertLive(fetch(WEATHER));
        clock.advance(Duration.ofMinutes(61));
        upstream.respond(WEATHER, "{\"temp\":75}");
        assertLive(fetch(WEATHER));

        restart();
        CacheKey key = CacheKey.of(Endpoint.of(WEATHER), Map.of());
        cache.invalidate(key);
        clock.advance(Duration.ofMinutes(61));
        upstream.failWith(WEATHER, 500);

        // When
        FetchResult result = fetch(WEATHER);

        // Then: the latest history record is served
        assertStale(result, Degradation.UPSTREAM_FAILED);
        assertEquals(CacheTier.HISTORY, result.tier());
        assertEquals("{\"temp\":75}", result.payload().asUtf8());
        assertEquals(2, cache.history(key, ManualClock.DEFAULT_START).size(),
            "Every successful fetch should be kept in history");
    }
}
