/**
 * Protection SPI (Service Provider Interface) 패키지.
 *
 * <p>외부 제공자 호출을 보호하는 두 가지 확장점을 정의합니다.
 * 두 컴포넌트 모두 호출 경로에서 예외를 던지지 않고 boolean 으로 거부를 알리며,
 * 오케스트레이터는 거부를 stale 응답으로 흡수합니다.</p>
 *
 * <h2>Protection 체인 순서</h2>
 *
 * <pre>
 * 1. RateLimiter.check    → provider 예산 확인 (비차감)
 * 2. CircuitBreaker.allow → OPEN 이면 즉시 거부, HALF_OPEN 이면 시험 1건만 통과
 * 3. RateLimiter.consume  → 워커가 실제 호출 직전 토큰 차감
 * 4. UpstreamFetcher      → 실제 호출 (타임아웃 적용)
 * 5. CircuitBreaker.record* → 결과 기록
 * </pre>
 *
 * <p>비차감 예산 확인이 {@code allow()} 보다 먼저 실행되므로,
 * 예산 때문에 어차피 거부될 요청이 HALF_OPEN 시험 기회를 소모하지 않습니다.</p>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지는 항상 허용하는 기본 구현을 제공합니다.
 * 예산이나 차단 없이 캐시와 워커 동작만 검증하는 테스트에서 사용합니다.</p>
 *
 * <pre>{@code
 * RateLimiter limiter = new NoOpRateLimiter();
 * CircuitBreaker cb = new NoOpCircuitBreaker();
 * }</pre>
 *
 * <p>실제 구현은 {@code feed-adapter-inmemory} 모듈의
 * {@code TokenBucketRateLimiter}, {@code ConsecutiveFailureCircuitBreaker} 입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see com.ryuqq.feed.core.protection.RateLimiter
 * @see com.ryuqq.feed.core.protection.CircuitBreaker
 * @see com.ryuqq.feed.core.protection.noop
 */
package com.ryuqq.feed.core.protection;
