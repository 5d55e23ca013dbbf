/**
 * 캐시 정책 및 통계 패키지.
 *
 * <p>{@link com.ryuqq.feed.core.cache.TtlPolicy} 는 이벤트 근접도로 TTL 을 결정하는 유일한 함수이며,
 * 모든 캐시 계층이 같은 정책을 공유합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.feed.core.cache;
