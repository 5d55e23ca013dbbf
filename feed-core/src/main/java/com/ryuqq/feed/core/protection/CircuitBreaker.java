package com.ryuqq.feed.core.protection;

import com.ryuqq.feed.core.model.Endpoint;

import java.util.Map;

/**
 * Circuit Breaker SPI.
 *
 * <p>엔드포인트별 연속 실패 수를 추적하고, 임계값 도달 시 빠르게 거부(Fail-Fast)하여
 * 장애가 난 제공자에 호출 예산을 낭비하지 않도록 합니다. 순수 상태 기계이며 I/O 를 하지 않습니다.</p>
 *
 * <p><strong>Circuit Breaker 패턴:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 연속 실패 수 추적</li>
 *   <li>OPEN: cooldown 동안 요청 차단</li>
 *   <li>HALF_OPEN: 시험 요청 정확히 1건 허용</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = ...;
 * Endpoint endpoint = Endpoint.of("odds_api/americanfootball_nfl/odds");
 *
 * if (!cb.allow(endpoint)) {
 *     // OPEN 상태 → stale 캐시로 응답
 *     return staleFallback(Degradation.BREAKER_OPEN);
 * }
 *
 * try {
 *     UpstreamResponse response = fetcher.fetch(endpoint, params);
 *     cb.recordSuccess(endpoint);
 *     return response;
 * } catch (UpstreamException e) {
 *     cb.recordFailure(endpoint, e);
 *     throw e;
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 요청 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 true</li>
     *   <li>OPEN: cooldown 경과 전 false, 경과 후 HALF_OPEN 으로 전이하며 true (1건)</li>
     *   <li>HALF_OPEN: 시험 요청이 이미 나갔으면 false</li>
     * </ul>
     *
     * @param endpoint 엔드포인트
     * @return true: 통과 허용, false: 차단
     */
    boolean allow(Endpoint endpoint);

    /**
     * 호출 성공 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 수 0 으로 초기화</li>
     *   <li>HALF_OPEN: CLOSED 로 전이</li>
     * </ul>
     *
     * @param endpoint 엔드포인트
     */
    void recordSuccess(Endpoint endpoint);

    /**
     * 호출 실패 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 수 증가, 임계값 도달 시 OPEN 으로 전이</li>
     *   <li>HALF_OPEN: 즉시 OPEN 으로 전이 (cooldown 재시작)</li>
     * </ul>
     *
     * @param endpoint 엔드포인트
     * @param throwable 발생한 예외 (로깅용, null 허용)
     */
    void recordFailure(Endpoint endpoint, Throwable throwable);

    /**
     * 현재 상태 조회.
     *
     * <p>조회만으로는 상태가 바뀌지 않습니다. cooldown 이 지난 OPEN 은 다음 {@link #allow(Endpoint)}
     * 호출 시 HALF_OPEN 으로 전이합니다.</p>
     *
     * @param endpoint 엔드포인트
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState(Endpoint endpoint);

    /**
     * 엔드포인트를 CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     *
     * @param endpoint 엔드포인트
     */
    void reset(Endpoint endpoint);

    /**
     * 지금까지 사용된 모든 엔드포인트의 스냅샷.
     *
     * @return 엔드포인트 → 스냅샷 (읽기 전용)
     */
    Map<Endpoint, BreakerSnapshot> snapshot();
}
