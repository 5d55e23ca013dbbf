package com.ryuqq.feed.core.protection;

import com.ryuqq.feed.core.model.Endpoint;

import java.time.Duration;
import java.time.Instant;

/**
 * 엔드포인트 Circuit Breaker 스냅샷.
 *
 * @param endpoint 엔드포인트
 * @param state 현재 상태
 * @param consecutiveFailures 연속 실패 수
 * @param openedAt 마지막 OPEN 전이 시각 (CLOSED 면 null)
 * @param currentCooldown 현재 적용 중인 cooldown
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record BreakerSnapshot(
    Endpoint endpoint,
    CircuitBreakerState state,
    int consecutiveFailures,
    Instant openedAt,
    Duration currentCooldown
) {

    public BreakerSnapshot {
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (currentCooldown == null) {
            throw new IllegalArgumentException("currentCooldown cannot be null");
        }
    }
}
