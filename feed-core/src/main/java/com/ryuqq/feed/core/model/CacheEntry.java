package com.ryuqq.feed.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * 캐시 계층에 저장된 하나의 응답.
 *
 * <p>{@code fetchedAt} 시점에 받은 Payload 와, 그 시점에 이벤트 근접도로 계산된 TTL 을 함께 보관합니다.
 * 엔트리 자체는 불변이며, 더 빠른 계층으로 승격될 때는 {@link #withTier(CacheTier)} 로 사본을 만듭니다.</p>
 *
 * <p><strong>신선도 규칙:</strong></p>
 * <ul>
 *   <li>stale ⇔ {@code now - fetchedAt > ttl}</li>
 *   <li>정확히 {@code fetchedAt + ttl} 시점은 아직 fresh</li>
 *   <li>한 번 stale 이 된 엔트리는 이후 모든 시점에서 stale (같은 엔트리 기준)</li>
 * </ul>
 *
 * @param key 캐시 키
 * @param endpoint 원본 엔드포인트
 * @param payload 응답 본문
 * @param fetchedAt 외부 제공자로부터 받은 시각
 * @param ttl 저장 시점에 계산된 TTL (양수)
 * @param tier 이 엔트리를 제공한 계층
 * @param eventTime 관련 이벤트 시각 (알 수 없으면 null)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CacheEntry(
    CacheKey key,
    Endpoint endpoint,
    Payload payload,
    Instant fetchedAt,
    Duration ttl,
    CacheTier tier,
    Instant eventTime
) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException 필수 필드가 null 이거나 ttl 이 양수가 아닌 경우
     */
    public CacheEntry {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (fetchedAt == null) {
            throw new IllegalArgumentException("fetchedAt cannot be null");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
        if (tier == null) {
            throw new IllegalArgumentException("tier cannot be null");
        }
    }

    /**
     * 주어진 시점 기준 stale 여부.
     *
     * @param now 기준 시각
     * @return {@code now - fetchedAt > ttl} 이면 true
     */
    public boolean isStaleAt(Instant now) {
        return ageAt(now).compareTo(ttl) > 0;
    }

    /**
     * 주어진 시점 기준 엔트리 나이.
     *
     * <p>시계가 역행한 경우 0 을 반환합니다.</p>
     *
     * @param now 기준 시각
     * @return {@code now - fetchedAt} (음수면 0)
     */
    public Duration ageAt(Instant now) {
        Duration age = Duration.between(fetchedAt, now);
        return age.isNegative() ? Duration.ZERO : age;
    }

    /**
     * 계층 정보만 바꾼 사본.
     *
     * @param newTier 새 계층
     * @return 새 CacheEntry
     */
    public CacheEntry withTier(CacheTier newTier) {
        return new CacheEntry(key, endpoint, payload, fetchedAt, ttl, newTier, eventTime);
    }
}
