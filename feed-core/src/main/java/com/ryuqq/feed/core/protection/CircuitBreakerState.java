package com.ryuqq.feed.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p>엔드포인트별 연속 실패 수를 추적하고,
 * 임계값 도달 시 요청을 차단하여 장애가 난 제공자에 호출이 몰리는 것을 방지합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 임계값 도달)
 * OPEN (차단)
 *   │
 *   ▼ (cooldown 경과)
 * HALF_OPEN (시험 요청 1건)
 *   │
 *   ├─► 성공 → CLOSED
 *   └─► 실패 → OPEN (cooldown 재시작)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>모든 요청이 통과하며 연속 실패 수를 추적합니다.
     * 연속 실패 수가 임계값에 도달하면 OPEN 상태로 전이합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>cooldown 동안 모든 요청을 거부합니다.
     * cooldown 이 경과하면 HALF_OPEN 상태로 전이합니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (시험 요청 1건만 통과).
     *
     * <p>동시 호출이 있어도 정확히 한 건만 통과시켜 제공자의 복구 여부를 확인합니다.
     * 시험 요청이 성공하면 CLOSED, 실패하면 다시 OPEN 으로 전이합니다.</p>
     */
    HALF_OPEN
}
