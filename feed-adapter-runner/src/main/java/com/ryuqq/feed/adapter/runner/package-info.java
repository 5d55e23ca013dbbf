/**
 * 작업 큐 기반 요청 조정 런타임.
 *
 * <p>{@link com.ryuqq.feed.adapter.runner.QueueWorkerRunner} 가
 * {@link com.ryuqq.feed.application.orchestrator.RequestOrchestrator} 와
 * {@link com.ryuqq.feed.application.runtime.Runtime} 을 함께 구현합니다.</p>
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>QueueWorkerRunner: 진행 중 요청 테이블, 우선순위 큐, 워커 풀</li>
 *   <li>QueueWorkerConfig: 워커 수, 재시도, 제한 시간 설정</li>
 *   <li>BackoffCalculator: 지수 백오프 + Jitter</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.feed.adapter.runner;
