package com.ryuqq.feed.core.cache;

import com.ryuqq.feed.core.model.CacheTier;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 캐시 조회 통계 스냅샷.
 *
 * <p>조회 시점의 값을 복사한 읽기 전용 객체입니다.</p>
 *
 * @param lookups 전체 조회 수
 * @param misses 모든 계층에서 실패한 조회 수
 * @param hitsByTier 계층별 적중 수
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CacheStats(long lookups, long misses, Map<CacheTier, Long> hitsByTier) {

    public CacheStats {
        if (lookups < 0) {
            throw new IllegalArgumentException("lookups cannot be negative (current: " + lookups + ")");
        }
        if (misses < 0) {
            throw new IllegalArgumentException("misses cannot be negative (current: " + misses + ")");
        }
        if (hitsByTier == null) {
            throw new IllegalArgumentException("hitsByTier cannot be null");
        }
        EnumMap<CacheTier, Long> copy = new EnumMap<>(CacheTier.class);
        copy.putAll(hitsByTier);
        hitsByTier = Collections.unmodifiableMap(copy);
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, Map.of());
    }

    /**
     * 계층별 적중 수.
     *
     * @param tier 계층
     * @return 적중 수 (기록이 없으면 0)
     */
    public long hits(CacheTier tier) {
        return hitsByTier.getOrDefault(tier, 0L);
    }

    /**
     * 계층별 적중률 (전체 조회 대비).
     *
     * @param tier 계층
     * @return 0.0 ~ 1.0 (조회가 없으면 0.0)
     */
    public double hitRate(CacheTier tier) {
        if (lookups == 0) {
            return 0.0;
        }
        return (double) hits(tier) / lookups;
    }

    /**
     * 전체 적중률.
     *
     * @return 0.0 ~ 1.0 (조회가 없으면 0.0)
     */
    public double overallHitRate() {
        if (lookups == 0) {
            return 0.0;
        }
        return (double) (lookups - misses) / lookups;
    }
}
