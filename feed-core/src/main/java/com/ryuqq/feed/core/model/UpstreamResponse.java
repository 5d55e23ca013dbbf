package com.ryuqq.feed.core.model;

import java.time.Instant;
import java.util.Optional;

/**
 * 외부 제공자 호출 응답.
 *
 * <p>Fetcher 가 응답 본문에서 이벤트 시각을 알아낸 경우 함께 전달하며,
 * 캐시는 이 값으로 TTL 을 계산합니다.</p>
 *
 * @param payload 응답 본문
 * @param eventTime 관련 이벤트 시각 (알 수 없으면 null)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record UpstreamResponse(Payload payload, Instant eventTime) {

    public UpstreamResponse {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
    }

    public static UpstreamResponse of(Payload payload) {
        return new UpstreamResponse(payload, null);
    }

    public static UpstreamResponse of(Payload payload, Instant eventTime) {
        return new UpstreamResponse(payload, eventTime);
    }

    public Optional<Instant> eventTimeIfKnown() {
        return Optional.ofNullable(eventTime);
    }
}
