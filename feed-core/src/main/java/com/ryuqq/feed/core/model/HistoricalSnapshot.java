package com.ryuqq.feed.core.model;

import java.time.Instant;

/**
 * append-only 이력 기록의 한 행.
 *
 * <p>시간대별 라인 변동(line movement), CLV 분석 등 외부 협력자가 추세 조회에 사용합니다.
 * 이력은 수정되거나 삭제되지 않습니다.</p>
 *
 * @param fetchTimestamp 외부 제공자로부터 받은 시각
 * @param key 캐시 키
 * @param providerEndpoint 원본 엔드포인트
 * @param payload 응답 본문
 * @param eventTime 관련 이벤트 시각 (알 수 없으면 null)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record HistoricalSnapshot(
    Instant fetchTimestamp,
    CacheKey key,
    Endpoint providerEndpoint,
    Payload payload,
    Instant eventTime
) {

    public HistoricalSnapshot {
        if (fetchTimestamp == null) {
            throw new IllegalArgumentException("fetchTimestamp cannot be null");
        }
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (providerEndpoint == null) {
            throw new IllegalArgumentException("providerEndpoint cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
    }

    /**
     * 캐시 엔트리로부터 이력 행 생성.
     *
     * @param entry 캐시 엔트리
     * @return HistoricalSnapshot
     */
    public static HistoricalSnapshot of(CacheEntry entry) {
        return new HistoricalSnapshot(
            entry.fetchedAt(), entry.key(), entry.endpoint(), entry.payload(), entry.eventTime());
    }
}
