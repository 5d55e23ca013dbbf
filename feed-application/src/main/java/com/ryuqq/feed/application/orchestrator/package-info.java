/**
 * 요청 조정자 계약.
 *
 * <p>{@link com.ryuqq.feed.application.orchestrator.RequestOrchestrator} 는 외부 데이터의 단일 진입점이며,
 * 구현체는 adapter-runner 모듈의 {@code QueueWorkerRunner} 입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.feed.application.orchestrator;
