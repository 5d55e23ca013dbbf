package com.ryuqq.feed.core.model;

/**
 * stale 응답이 반환된 사유.
 *
 * <p>오케스트레이터는 Rate Limit, Circuit Breaker, 외부 장애를 호출자에게 예외로 전파하지 않고
 * 마지막으로 알려진 값을 반환합니다. 이 열거형은 그 이유를 설명합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Degradation {

    /** 정상 응답 (fresh 캐시 또는 실시간 호출 성공). */
    NONE,

    /** provider 의 호출 예산 부족으로 갱신을 건너뜀. */
    RATE_LIMITED,

    /** 엔드포인트 Circuit Breaker 가 OPEN 이라 갱신을 건너뜀. */
    BREAKER_OPEN,

    /** 재시도를 모두 소진했거나 대기 시간을 초과함. */
    UPSTREAM_FAILED
}
