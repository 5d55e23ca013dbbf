package com.ryuqq.feed.core.protection.noop;

import com.ryuqq.feed.core.model.Endpoint;
import com.ryuqq.feed.core.protection.CircuitBreaker;
import com.ryuqq.feed.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NoOpCircuitBreaker 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("NoOpCircuitBreaker 테스트")
class NoOpCircuitBreakerTest {

    private final Endpoint endpoint = Endpoint.of("espn_api/scoreboard");

    @Test
    @DisplayName("실패를 아무리 기록해도 allow() 는 항상 true를 반환한다")
    void 실패_기록_후에도_항상_허용() {
        // given
        CircuitBreaker cb = new NoOpCircuitBreaker();

        // when
        for (int i = 0; i < 100; i++) {
            cb.recordFailure(endpoint, new RuntimeException("boom"));
        }

        // then
        assertTrue(cb.allow(endpoint));
        assertEquals(CircuitBreakerState.CLOSED, cb.getState(endpoint));
    }

    @Test
    @DisplayName("snapshot() 은 빈 Map 을 반환한다")
    void snapshot_빈_Map() {
        // given
        CircuitBreaker cb = new NoOpCircuitBreaker();

        // when & then
        assertDoesNotThrow(() -> cb.reset(endpoint));
        assertTrue(cb.snapshot().isEmpty());
    }
}
