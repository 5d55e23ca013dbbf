/**
 * 예외 패키지.
 *
 * <p>{@link com.ryuqq.feed.core.exception.NoDataAvailableException} 만 호출자에게 전파되며,
 * 나머지는 오케스트레이터와 캐시 저장소 내부에서 흡수됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.feed.core.exception;
