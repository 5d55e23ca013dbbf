package com.ryuqq.feed.core.protection;

import java.time.Duration;

/**
 * Rate Limiter 설정.
 *
 * <p>provider 하나의 Token Bucket 크기와 보충 속도를 정의합니다.
 * 월 단위, 일 단위 할당량은 {@link #perPeriod(long, Duration)} 로 초당 보충 속도로 환산합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>월 500회 (30일): {@code RateLimiterConfig.perPeriod(500, Duration.ofDays(30))}</li>
 *   <li>일 100회: {@code RateLimiterConfig.perDay(100)}</li>
 *   <li>10개, 초당 1개: {@code new RateLimiterConfig(10, 1.0)}</li>
 * </ul>
 *
 * @param capacity 버킷 최대 토큰 수
 * @param refillRatePerSecond 초당 보충 토큰 수
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RateLimiterConfig(long capacity, double refillRatePerSecond) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if capacity is not positive
     * @throws IllegalArgumentException if refillRatePerSecond is not positive
     */
    public RateLimiterConfig {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        if (!(refillRatePerSecond > 0) || Double.isInfinite(refillRatePerSecond)) {
            throw new IllegalArgumentException(
                "refillRatePerSecond must be positive (current: " + refillRatePerSecond + ")");
        }
    }

    /**
     * 기간당 할당량으로 생성 (버킷 크기 = 할당량).
     *
     * @param quota 기간 내 허용 호출 수
     * @param period 기간
     * @return RateLimiterConfig
     */
    public static RateLimiterConfig perPeriod(long quota, Duration period) {
        if (period == null || period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("period must be positive (current: " + period + ")");
        }
        double seconds = period.toMillis() / 1000.0;
        return new RateLimiterConfig(quota, quota / seconds);
    }

    public static RateLimiterConfig perDay(long quota) {
        return perPeriod(quota, Duration.ofDays(1));
    }

    public RateLimiterConfig withCapacity(long newCapacity) {
        return new RateLimiterConfig(newCapacity, refillRatePerSecond);
    }

    public RateLimiterConfig withRefillRatePerSecond(double newRefillRatePerSecond) {
        return new RateLimiterConfig(capacity, newRefillRatePerSecond);
    }
}
