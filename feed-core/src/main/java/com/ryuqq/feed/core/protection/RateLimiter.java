package com.ryuqq.feed.core.protection;

import java.util.Map;

/**
 * Rate Limiter SPI.
 *
 * <p>provider 별 호출 예산을 Token Bucket 으로 관리하여 유료/제한 API 의 할당량 초과를 방지합니다.
 * 모든 보충(refill)은 조회 시점에 지연 계산되며, 백그라운드 스레드를 사용하지 않습니다.</p>
 *
 * <p><strong>check 와 consume 의 분리:</strong></p>
 * <ul>
 *   <li>{@link #check(String, int)}: 토큰을 차감하지 않고 가능 여부만 확인 (요청 admission 단계)</li>
 *   <li>{@link #consume(String, int)}: 실제 호출 직전 토큰 차감 (실패 시 아무것도 차감하지 않음)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RateLimiter limiter = ...;
 *
 * if (!limiter.check("odds_api", 1)) {
 *     // 예산 부족 → stale 캐시로 응답
 *     return staleFallback(Degradation.RATE_LIMITED);
 * }
 *
 * // 워커에서 실제 호출 직전
 * if (limiter.consume("odds_api", 1)) {
 *     UpstreamResponse response = fetcher.fetch(endpoint, params);
 * }
 * }</pre>
 *
 * <p><strong>예산 불변식:</strong> 임의의 구간 [t0, t1] 동안 소비된 토큰 합은
 * {@code capacity + refillRatePerSecond × (t1 - t0)} 를 넘지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 토큰 n 개 사용 가능 여부 확인 (비차감).
     *
     * @param provider provider 이름
     * @param tokens 필요한 토큰 수 (양수)
     * @return true: 사용 가능, false: 예산 부족
     */
    boolean check(String provider, int tokens);

    /**
     * 토큰 n 개 차감 시도.
     *
     * <p>사용 가능하면 차감 후 true, 부족하면 아무것도 차감하지 않고 false 를 반환합니다.</p>
     *
     * @param provider provider 이름
     * @param tokens 차감할 토큰 수 (양수)
     * @return true: 차감 성공, false: 예산 부족
     */
    boolean consume(String provider, int tokens);

    /**
     * 현재 남은 토큰 수 (지연 보충 반영).
     *
     * @param provider provider 이름
     * @return 남은 토큰 수
     */
    double remaining(String provider);

    /**
     * 예산 상태 조회.
     *
     * @param provider provider 이름
     * @return OK, WARNING, CRITICAL, EXHAUSTED 중 하나
     */
    RateLimitStatus status(String provider);

    /**
     * provider 버킷을 가득 찬 상태로 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     *
     * @param provider provider 이름
     */
    void reset(String provider);

    /**
     * provider 설정 조회.
     *
     * @param provider provider 이름
     * @return 적용 중인 설정
     */
    RateLimiterConfig getConfig(String provider);

    /**
     * 지금까지 사용된 모든 provider 의 예산 스냅샷.
     *
     * @return provider → 스냅샷 (읽기 전용)
     */
    Map<String, BudgetSnapshot> snapshot();
}
