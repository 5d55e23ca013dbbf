package com.ryuqq.feed.application.orchestrator;

import com.ryuqq.feed.core.cache.CacheStats;
import com.ryuqq.feed.core.model.Endpoint;
import com.ryuqq.feed.core.protection.BreakerSnapshot;
import com.ryuqq.feed.core.protection.BudgetSnapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 오케스트레이터 통계 스냅샷.
 *
 * <p>호출 시점의 값을 복사한 읽기 전용 객체이며, 조회가 상태를 바꾸지 않습니다.</p>
 *
 * @param cache 캐시 계층별 적중 통계
 * @param budgets provider 별 예산
 * @param breakers 엔드포인트별 Circuit Breaker 상태
 * @param queueDepth 큐에서 대기 중인 요청 수
 * @param inFlight 진행 중인 요청 수 (대기 + 실행 + 재시도 대기)
 * @param requests 전체 fetch 호출 수
 * @param dedupAttaches 진행 중 요청에 합류한 호출 수
 * @param upstreamCalls 실제 외부 호출 수 (재시도 포함)
 * @param degradedResponses stale 로 응답한 호출 수
 * @param providers provider 별 외부 호출 지연 시간, 실패, 재시도 통계
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OrchestratorStats(
    CacheStats cache,
    Map<String, BudgetSnapshot> budgets,
    Map<Endpoint, BreakerSnapshot> breakers,
    int queueDepth,
    int inFlight,
    long requests,
    long dedupAttaches,
    long upstreamCalls,
    long degradedResponses,
    Map<String, ProviderCallStats> providers
) {

    public OrchestratorStats {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        budgets = budgets == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(budgets));
        breakers = breakers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(breakers));
        providers = providers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(providers));
    }
}
