package com.ryuqq.feed.core.model;

import java.time.Duration;

/**
 * {@code fetch} 호출의 결과.
 *
 * <p><strong>필드 의미:</strong></p>
 * <ul>
 *   <li>tier: 응답을 제공한 계층 (실시간 호출이면 {@link CacheTier#LIVE})</li>
 *   <li>age: 응답 시점 기준 데이터 나이</li>
 *   <li>stale: TTL 또는 호출자가 요청한 maxAge 를 넘긴 데이터인지 여부</li>
 *   <li>degradation: stale 응답이 반환된 사유</li>
 * </ul>
 *
 * @param key 캐시 키
 * @param payload 응답 본문
 * @param tier 응답 계층
 * @param age 데이터 나이
 * @param stale stale 여부
 * @param degradation 저하 사유
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record FetchResult(
    CacheKey key,
    Payload payload,
    CacheTier tier,
    Duration age,
    boolean stale,
    Degradation degradation
) {

    public FetchResult {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (tier == null) {
            throw new IllegalArgumentException("tier cannot be null");
        }
        if (age == null || age.isNegative()) {
            throw new IllegalArgumentException("age cannot be null or negative (current: " + age + ")");
        }
        if (degradation == null) {
            throw new IllegalArgumentException("degradation cannot be null");
        }
    }

    /**
     * 실시간 호출 성공 결과.
     *
     * @param key 캐시 키
     * @param payload 응답 본문
     * @return LIVE 결과
     */
    public static FetchResult live(CacheKey key, Payload payload) {
        return new FetchResult(key, payload, CacheTier.LIVE, Duration.ZERO, false, Degradation.NONE);
    }

    /**
     * 캐시 적중 결과.
     *
     * @param entry 캐시 엔트리
     * @param age 데이터 나이
     * @param stale stale 여부
     * @param degradation 저하 사유
     * @return 캐시 결과
     */
    public static FetchResult fromCache(CacheEntry entry, Duration age, boolean stale, Degradation degradation) {
        return new FetchResult(entry.key(), entry.payload(), entry.tier(), age, stale, degradation);
    }

    public boolean isDegraded() {
        return degradation != Degradation.NONE;
    }
}
