package com.ryuqq.feed.testkit.contract;

import com.ryuqq.feed.core.model.CacheTier;
import com.ryuqq.feed.core.model.FetchResult;
import com.ryuqq.feed.core.model.Payload;
import com.ryuqq.feed.core.model.Priority;
import com.ryuqq.feed.core.model.UpstreamResponse;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for request deduplication.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Concurrent callers for one key share a single upstream call</li>
 *   <li>A resolved request is served from the memory tier afterwards</li>
 *   <li>Parameter order does not split the key, parameter values do</li>
 *   <li>Separator characters inside a value do not merge two different parameter sets</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DeduplicationContractTest extends AbstractContractTest {

    private static final String SCOREBOARD = "espn_api/scoreboard";
    private static final String ODDS = "odds_api/americanfootball_nfl/odds";

    @Test
    void testDedup_ConcurrentCallers_ShareOneUpstreamCall() throws Exception {
        // Given: the upstream blocks until released
        upstream.respond(SCOREBOARD, "{\"week\":1}");
        upstream.hold();

        // When: five callers ask for the same key while the first call is in flight
        List<Future<FetchResult>> results = new ArrayList<>();
        results.add(fetchAsync(SCOREBOARD, Map.of("week", "1"), Priority.NORMAL));
        assertTrue(upstream.awaitCalls(1, Duration.ofSeconds(5)), "First call should reach the upstream");
        for (int i = 0; i < 4; i++) {
            results.add(fetchAsync(SCOREBOARD, Map.of("week", "1"), Priority.NORMAL));
        }
        awaitUntil(() -> orchestrator.stats().dedupAttaches() == 4, "four callers attached");
        upstream.release();

        // Then: every caller gets the same live payload from one network call
        for (Future<FetchResult> future : results) {
            FetchResult result = future.get(5, TimeUnit.SECONDS);
            assertLive(result);
            assertEquals("{\"week\":1}", result.payload().asUtf8());
        }
        assertEquals(1, upstream.callCount(), "Only one upstream call should be made");
        assertEquals(5, orchestrator.stats().requests());
        assertEquals(0, orchestrator.stats().inFlight(), "Nothing should stay pending");
    }

    @Test
    void testDedup_AfterResolution_ServesFromMemory() {
        // Given
        upstream.respond(SCOREBOARD, "{\"week\":2}");
        assertLive(fetch(SCOREBOARD));

        // When: a second caller arrives after the first resolved
        FetchResult second = fetch(SCOREBOARD);

        // Then: no new network call
        assertFreshFrom(second, CacheTier.MEMORY);
        assertEquals(1, upstream.callCount());
    }

    @Test
    void testDedup_ParameterOrderIgnored_ValuesDistinguish() {
        // Given
        upstream.respond(SCOREBOARD, "{}");
        assertLive(fetch(SCOREBOARD, Map.of("week", "1", "season", "2025"), Priority.NORMAL));

        // When
        FetchResult reordered = fetch(SCOREBOARD, Map.of("season", "2025", "week", "1"), Priority.NORMAL);
        FetchResult otherWeek = fetch(SCOREBOARD, Map.of("season", "2025", "week", "2"), Priority.NORMAL);

        // Then
        assertFreshFrom(reordered, CacheTier.MEMORY);
        assertLive(otherWeek);
        assertEquals(2, upstream.callCount());
    }

    @Test
    void testDedup_SeparatorsInsideValue_KeepKeysApart() {
        // Given: the upstream echoes the parameter set it was called with
        upstream.always(ODDS, (endpoint, params) ->
            UpstreamResponse.of(Payload.ofUtf8(String.valueOf(new TreeMap<>(params))), null));
        Map<String, String> joined = Map.of("markets", "h2h&regions=us");
        Map<String, String> split = new LinkedHashMap<>();
        split.put("markets", "h2h");
        split.put("regions", "us");

        // When
        FetchResult first = fetch(ODDS, joined, Priority.NORMAL);
        FetchResult second = fetch(ODDS, split, Priority.NORMAL);

        // Then: each parameter set gets its own upstream call and its own payload
        assertLive(first);
        assertLive(second);
        assertEquals("{markets=h2h&regions=us}", first.payload().asUtf8());
        assertEquals("{markets=h2h, regions=us}", second.payload().asUtf8());
        assertEquals(2, upstream.callCount());
    }
}
