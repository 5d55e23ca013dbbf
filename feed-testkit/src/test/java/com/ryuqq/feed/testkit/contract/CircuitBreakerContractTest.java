package com.ryuqq.feed.testkit.contract;

import com.ryuqq.feed.core.model.Degradation;
import com.ryuqq.feed.core.model.Endpoint;
import com.ryuqq.feed.core.model.FetchResult;
import com.ryuqq.feed.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the per-endpoint circuit breaker inside the pipeline.
 *
 * <p>Breaker: three consecutive failures, 30 second cooldown.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>OPEN: cached data is served without touching the network</li>
 *   <li>After cooldown: exactly one trial call, success closes the circuit</li>
 *   <li>Failed trial: circuit re-opens immediately</li>
 *   <li>Breakers are isolated per endpoint</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CircuitBreakerContractTest extends AbstractContractTest {

    private static final String SCORES = "espn_api/scores";
    private static final Endpoint SCORES_ENDPOINT = Endpoint.of(SCORES);

    @BeforeEach
    void openBreaker() {
        // Given: a cached copy that has expired, then three failed refreshes
        upstream.respond(SCORES, "{\"home\":21}");
        assertLive(fetch(SCORES));
        clock.advance(Duration.ofMinutes(61));
        upstream.failWith(SCORES, 503);

        for (int i = 0; i < 3; i++) {
            assertStale(fetch(SCORES), Degradation.UPSTREAM_FAILED);
        }
        assertEquals(CircuitBreakerState.OPEN, circuitBreaker.getState(SCORES_ENDPOINT),
            "Circuit should be OPEN after three consecutive failures");
        assertEquals(4, upstream.callCount());
    }

    @Test
    void testCircuitBreaker_OpenState_ServesCacheWithoutNetwork() {
        // When: 10 seconds into the cooldown
        clock.advance(Duration.ofSeconds(10));
        FetchResult result = fetch(SCORES);

        // Then
        assertStale(result, Degradation.BREAKER_OPEN);
        assertEquals("{\"home\":21}", result.payload().asUtf8());
        assertEquals(4, upstream.callCount(), "OPEN circuit should not reach the network");
    }

    @Test
    void testCircuitBreaker_AfterCooldown_SingleTrialClosesCircuit() {
        // Given
        clock.advance(Duration.ofSeconds(10));
        assertStale(fetch(SCORES), Degradation.BREAKER_OPEN);
        upstream.respond(SCORES, "{\"home\":28}");

        // When: 31 seconds after opening
        clock.advance(Duration.ofSeconds(21));
        FetchResult trial = fetch(SCORES);

        // Then
        assertLive(trial);
        assertEquals("{\"home\":28}", trial.payload().asUtf8());
        assertEquals(5, upstream.callCount(), "Exactly one trial call should be made");
        assertEquals(CircuitBreakerState.CLOSED, circuitBreaker.getState(SCORES_ENDPOINT));
    }

    @Test
    void testCircuitBreaker_FailedTrial_ReopensCircuit() {
        // When: the trial fails as well
        clock.advance(Duration.ofSeconds(31));
        FetchResult trial = fetch(SCORES);

        // Then
        assertStale(trial, Degradation.UPSTREAM_FAILED);
        assertEquals(5, upstream.callCount());
        assertEquals(CircuitBreakerState.OPEN, circuitBreaker.getState(SCORES_ENDPOINT));

        FetchResult afterTrial = fetch(SCORES);
        assertStale(afterTrial, Degradation.BREAKER_OPEN);
        assertEquals(5, upstream.callCount(), "Re-opened circuit should reject immediately");
    }

    @Test
    void testCircuitBreaker_OtherEndpoint_Unaffected() {
        // Given
        upstream.respond("espn_api/standings", "{\"rank\":1}");

        // When
        FetchResult result = fetch("espn_api/standings");

        // Then
        assertLive(result);
        assertEquals(CircuitBreakerState.CLOSED, circuitBreaker.getState(Endpoint.of("espn_api/standings")));
    }
}
