package com.ryuqq.feed.application.orchestrator;

import com.ryuqq.feed.core.exception.NoDataAvailableException;
import com.ryuqq.feed.core.model.Endpoint;
import com.ryuqq.feed.core.model.FetchResult;
import com.ryuqq.feed.core.model.Priority;

import java.time.Duration;
import java.util.Map;

/**
 * 외부 데이터 요청 조정자.
 *
 * <p>모든 외부 데이터 소비자(스크래퍼, 특징 추출, 실시간 폴러)의 단일 진입점입니다.
 * 캐시, Rate Limiter, Circuit Breaker, 작업 큐를 조합하여 호출 예산을 지키면서
 * 가능한 가장 신선한 데이터를 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * FetchResult result = orchestrator.fetch(
 *     Endpoint.of("odds_api/americanfootball_nfl/odds"),
 *     Map.of("markets", "spreads", "regions", "us"),
 *     Priority.HIGH,
 *     Duration.ofMinutes(5)
 * );
 *
 * if (result.stale()) {
 *     // 저하 응답: result.degradation() 으로 사유 확인
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RequestOrchestrator {

    /**
     * 데이터 조회.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>CacheKey 생성 후 캐시 조회, fresh 이고 {@code age ≤ maxAge} 이면 즉시 반환</li>
     *   <li>같은 키의 진행 중 요청이 있으면 그 결과를 함께 기다림 (dedup)</li>
     *   <li>예산 확인(비차감) → Circuit Breaker 확인, 거부 시 stale 응답</li>
     *   <li>작업 큐에 등록, 워커가 호출/재시도 후 결과를 모든 대기자에게 전달</li>
     * </ol>
     *
     * @param endpoint 엔드포인트
     * @param params 요청 파라미터 (null 이면 빈 파라미터)
     * @param priority 우선순위
     * @param maxAge 허용 가능한 최대 데이터 나이 (null 이면 TTL 만 적용)
     * @return 조회 결과 (stale 일 수 있음)
     * @throws NoDataAvailableException 키에 대한 데이터가 전혀 없고 실시간 호출도 실패한 경우
     * @throws IllegalStateException 런타임이 시작되지 않은 경우
     * @throws IllegalArgumentException endpoint 또는 priority 가 null 인 경우
     */
    FetchResult fetch(Endpoint endpoint, Map<String, String> params, Priority priority, Duration maxAge);

    /**
     * NORMAL 우선순위, maxAge 제한 없이 조회.
     *
     * @param endpoint 엔드포인트
     * @param params 요청 파라미터
     * @return 조회 결과
     */
    default FetchResult fetch(Endpoint endpoint, Map<String, String> params) {
        return fetch(endpoint, params, Priority.NORMAL, null);
    }

    /**
     * 통계 스냅샷 (읽기 전용).
     *
     * @return 캐시/예산/Circuit Breaker/큐 상태
     */
    OrchestratorStats stats();
}
