package com.ryuqq.feed.core.protection;

import java.time.Duration;

/**
 * Circuit Breaker 설정.
 *
 * <p>시험 요청이 실패할 때마다 cooldown 에 {@code cooldownMultiplier} 를 곱하며,
 * {@code maxCooldown} 을 넘지 않습니다. 시험 요청이 성공하면 cooldown 은 기본값으로 돌아갑니다.</p>
 *
 * @param failureThreshold OPEN 으로 전이하는 연속 실패 수
 * @param cooldown 기본 cooldown
 * @param cooldownMultiplier 시험 실패 시 cooldown 배율 (1.0 이상)
 * @param maxCooldown cooldown 상한 (cooldown 이상)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    Duration cooldown,
    double cooldownMultiplier,
    Duration maxCooldown
) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException 값이 유효하지 않은 경우
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")");
        }
        if (cooldown == null || cooldown.isNegative() || cooldown.isZero()) {
            throw new IllegalArgumentException("cooldown must be positive (current: " + cooldown + ")");
        }
        if (cooldownMultiplier < 1.0) {
            throw new IllegalArgumentException(
                "cooldownMultiplier must be at least 1.0 (current: " + cooldownMultiplier + ")");
        }
        if (maxCooldown == null || maxCooldown.compareTo(cooldown) < 0) {
            throw new IllegalArgumentException(
                "maxCooldown must be at least cooldown (current: " + maxCooldown + ")");
        }
    }

    /**
     * 고정 cooldown 설정 (배율 1.0).
     *
     * @param failureThreshold 연속 실패 임계값
     * @param cooldown cooldown
     * @return CircuitBreakerConfig
     */
    public static CircuitBreakerConfig of(int failureThreshold, Duration cooldown) {
        return new CircuitBreakerConfig(failureThreshold, cooldown, 1.0, cooldown);
    }

    /**
     * 기본 설정 (5회 / 60초).
     *
     * @return 기본 CircuitBreakerConfig
     */
    public static CircuitBreakerConfig defaults() {
        return of(5, Duration.ofSeconds(60));
    }

    /**
     * 현재 cooldown 다음에 적용할 cooldown.
     *
     * @param current 현재 cooldown
     * @return {@code min(current × multiplier, maxCooldown)}
     */
    public Duration nextCooldown(Duration current) {
        long grown = (long) (current.toMillis() * cooldownMultiplier);
        return grown >= maxCooldown.toMillis() ? maxCooldown : Duration.ofMillis(grown);
    }

    public CircuitBreakerConfig withFailureThreshold(int newFailureThreshold) {
        return new CircuitBreakerConfig(newFailureThreshold, cooldown, cooldownMultiplier, maxCooldown);
    }

    public CircuitBreakerConfig withCooldown(Duration newCooldown) {
        Duration max = maxCooldown.compareTo(newCooldown) < 0 ? newCooldown : maxCooldown;
        return new CircuitBreakerConfig(failureThreshold, newCooldown, cooldownMultiplier, max);
    }

    public CircuitBreakerConfig withBackoff(double newMultiplier, Duration newMaxCooldown) {
        return new CircuitBreakerConfig(failureThreshold, cooldown, newMultiplier, newMaxCooldown);
    }
}
