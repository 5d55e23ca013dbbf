package com.ryuqq.feed.core.model;

/**
 * 응답을 제공한 저장 계층.
 *
 * <pre>
 * MEMORY  (프로세스 메모리, 재시작 시 소멸)
 *   ↓ miss
 * FILE    (디스크 스냅샷 파일)
 *   ↓ miss
 * HISTORY (append-only 이력 기록)
 *   ↓ miss
 * LIVE    (외부 제공자 실시간 호출)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CacheTier {
    MEMORY,
    FILE,
    HISTORY,
    LIVE
}
