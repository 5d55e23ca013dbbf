package com.ryuqq.feed.core.protection;

/**
 * provider 예산 상태.
 *
 * <p>남은 토큰 비율로 결정됩니다.</p>
 *
 * <pre>
 * OK        남은 비율 ≥ 50%
 * WARNING   남은 비율 ≥ 10%
 * CRITICAL  남은 토큰 &gt; 0
 * EXHAUSTED 남은 토큰 없음 (1개 미만)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RateLimitStatus {
    OK,
    WARNING,
    CRITICAL,
    EXHAUSTED;

    /**
     * 남은 토큰 수로부터 상태 계산.
     *
     * @param remaining 남은 토큰 수
     * @param capacity 버킷 크기
     * @return 상태
     */
    public static RateLimitStatus of(double remaining, long capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        if (remaining < 1.0) {
            return EXHAUSTED;
        }
        double ratio = remaining / capacity;
        if (ratio >= 0.5) {
            return OK;
        }
        if (ratio >= 0.1) {
            return WARNING;
        }
        return CRITICAL;
    }

    /**
     * 예산 보존이 필요한 상태인지 여부.
     *
     * @return CRITICAL 또는 EXHAUSTED 이면 true
     */
    public boolean isConserving() {
        return this == CRITICAL || this == EXHAUSTED;
    }
}
