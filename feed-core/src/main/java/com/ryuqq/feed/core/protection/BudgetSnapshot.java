package com.ryuqq.feed.core.protection;

/**
 * provider 예산 스냅샷.
 *
 * @param provider provider 이름
 * @param remaining 남은 토큰 수
 * @param capacity 버킷 크기
 * @param refillRatePerSecond 초당 보충 토큰 수
 * @param status 예산 상태
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record BudgetSnapshot(
    String provider,
    double remaining,
    long capacity,
    double refillRatePerSecond,
    RateLimitStatus status
) {

    public BudgetSnapshot {
        if (provider == null || provider.isBlank()) {
            throw new IllegalArgumentException("provider cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    /**
     * 남은 비율 (0.0 ~ 1.0).
     *
     * @return remaining / capacity
     */
    public double remainingRatio() {
        return remaining / capacity;
    }
}
