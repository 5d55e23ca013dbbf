package com.ryuqq.feed.testkit.contract;

import com.ryuqq.feed.core.exception.NoDataAvailableException;
import com.ryuqq.feed.core.model.Degradation;
import com.ryuqq.feed.core.model.Endpoint;
import com.ryuqq.feed.core.model.FetchResult;
import com.ryuqq.feed.core.model.Priority;
import com.ryuqq.feed.core.protection.RateLimitStatus;
import com.ryuqq.feed.core.protection.RateLimiterConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for provider budgets inside the pipeline.
 *
 * <p>odds_api: 10 tokens, refilled at 1 per second. noaa_api: 100 tokens with a negligible refill,
 * used for the low-priority conservation scenario.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RateBudgetContractTest extends AbstractContractTest {

    private static final String ODDS = "odds_api/odds";
    private static final String FORECAST = "noaa_api/forecast";

    @Override
    protected Map<String, RateLimiterConfig> rateLimits() {
        return Map.of(
            "odds_api", new RateLimiterConfig(10, 1.0),
            "noaa_api", new RateLimiterConfig(100, 0.0001)
        );
    }

    @Test
    void testBudget_Exhausted_RejectsUncachedKey() {
        // Given: ten distinct keys drain the bucket
        upstream.respond(ODDS, "{}");
        for (int i = 0; i < 10; i++) {
            assertLive(fetch(ODDS, Map.of("event", String.valueOf(i)), Priority.NORMAL));
        }

        // When: an eleventh key arrives in the same instant
        NoDataAvailableException error = assertThrows(NoDataAvailableException.class,
            () -> fetch(ODDS, Map.of("event", "10"), Priority.NORMAL));

        // Then
        assertEquals(Degradation.RATE_LIMITED, error.getReason());
        assertEquals(10, upstream.callCount());
        assertEquals(RateLimitStatus.EXHAUSTED, rateLimiter.status("odds_api"));
    }

    @Test
    void testBudget_AfterOneSecond_OneMoreCallAllowed() {
        // Given
        upstream.respond(ODDS, "{}");
        for (int i = 0; i < 10; i++) {
            fetch(ODDS, Map.of("event", String.valueOf(i)), Priority.NORMAL);
        }

        // When
        clock.advance(Duration.ofSeconds(1));
        FetchResult refilled = fetch(ODDS, Map.of("event", "10"), Priority.NORMAL);

        // Then
        assertLive(refilled);
        assertThrows(NoDataAvailableException.class,
            () -> fetch(ODDS, Map.of("event", "11"), Priority.NORMAL));
        assertEquals(11, upstream.callCount());
    }

    @Test
    void testBudget_Exhausted_ServesCachedKeyStale() {
        // Given
        upstream.respond(ODDS, "{\"line\":\"first\"}");
        for (int i = 0; i < 10; i++) {
            fetch(ODDS, Map.of("event", String.valueOf(i)), Priority.NORMAL);
        }
        clock.advance(Duration.ofMillis(100));

        // When: a caller insists on a fresh copy of a cached key
        FetchResult result = orchestrator.fetch(Endpoint.of(ODDS), Map.of("event", "0"), Priority.HIGH, Duration.ZERO);

        // Then
        assertStale(result, Degradation.RATE_LIMITED);
        assertEquals("{\"line\":\"first\"}", result.payload().asUtf8());
        assertEquals(10, upstream.callCount());
    }

    @Test
    void testBudget_CallsNeverExceedCapacityPlusRefill() {
        // Given
        upstream.respond(ODDS, "{}");
        int served = 0;

        // When: 60 distinct keys over 12 seconds
        for (int i = 0; i < 60; i++) {
            clock.advance(Duration.ofMillis(200));
            try {
                fetch(ODDS, Map.of("event", String.valueOf(i)), Priority.NORMAL);
                served++;
            } catch (NoDataAvailableException e) {
                assertEquals(Degradation.RATE_LIMITED, e.getReason());
            }
        }

        // Then: at most 10 + 1/s * 12s upstream calls
        assertTrue(upstream.callCount() <= 22,
            "Upstream calls should stay within budget, got " + upstream.callCount());
        assertEquals(served, upstream.callCount());
    }

    @Test
    void testBudget_ProvidersAreIsolated() {
        // Given
        upstream.respond(ODDS, "{}");
        upstream.respond("espn_api/scoreboard", "{}");
        for (int i = 0; i < 10; i++) {
            fetch(ODDS, Map.of("event", String.valueOf(i)), Priority.NORMAL);
        }

        // When
        FetchResult other = fetch("espn_api/scoreboard");

        // Then
        assertLive(other);
    }

    @Test
    void testBudget_CriticalLevel_LowPriorityRefreshSkipped() {
        // Given: a cached forecast and a nearly drained noaa budget
        upstream.respond(FORECAST, "{\"temp\":72}");
        assertLive(fetch(FORECAST));
        assertTrue(rateLimiter.consume("noaa_api", 90));
        clock.advance(Duration.ofMinutes(61));
        assertEquals(RateLimitStatus.CRITICAL, rateLimiter.status("noaa_api"));

        // When
        FetchResult low = fetch(FORECAST, Map.of(), Priority.LOW);
        FetchResult normal = fetch(FORECAST, Map.of(), Priority.NORMAL);

        // Then: LOW keeps the stale copy, NORMAL spends a token
        assertStale(low, Degradation.RATE_LIMITED);
        assertLive(normal);
        assertEquals(2, upstream.callCount());
    }
}
