/**
 * 설정 로딩.
 *
 * <p>{@link com.ryuqq.feed.application.config.GatewayProperties} 가 {@code feed.*} 프로퍼티를 읽어
 * Rate Limit, Circuit Breaker, TTL, 작업자, 캐시 경로, HTTP 접속 정보를 생성합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.feed.application.config;
