package com.ryuqq.feed.adapter.runner;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 지수적으로 증가시키되, Jitter를 추가하여
 * 같은 provider 로 재시도가 한꺼번에 몰리지 않도록 합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(attemptCount-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1s, maxDelay=30s, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attemptCount=1: 1000-1100ms</li>
 *   <li>attemptCount=2: 2000-2200ms</li>
 *   <li>attemptCount=3: 4000-4400ms</li>
 *   <li>attemptCount=6: 32000ms → maxDelay 30000ms 로 제한</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private static final int MAX_SHIFT = 30;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=1s, maxDelay=30s, jitterFactor=0.1</p>
     */
    public BackoffCalculator() {
        this(Duration.ofSeconds(1), Duration.ofSeconds(30), 0.1);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelay 기본 지연 시간 (양수여야 함)
     * @param maxDelay 최대 지연 시간 (baseDelay 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(Duration baseDelay, Duration maxDelay, double jitterFactor) {
        this(baseDelay, maxDelay, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 소스를 주입하는 생성자 (테스트용).
     *
     * @param baseDelay 기본 지연 시간
     * @param maxDelay 최대 지연 시간
     * @param jitterFactor Jitter 비율
     * @param random [0, 1) 범위 난수 소스
     */
    BackoffCalculator(Duration baseDelay, Duration maxDelay, double jitterFactor, DoubleSupplier random) {
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive (current: " + baseDelay + ")");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }

        this.baseDelayMs = baseDelay.toMillis();
        this.maxDelayMs = maxDelay.toMillis();
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attemptCount 지금까지 실패한 시도 횟수 (1부터 시작)
     * @return 재시도 전 대기 시간
     * @throws IllegalArgumentException attemptCount가 양수가 아닌 경우
     */
    public Duration calculate(int attemptCount) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException(
                "attemptCount must be positive (current: " + attemptCount + ")"
            );
        }

        // shift 는 overflow 방지를 위해 제한
        int shift = Math.min(attemptCount - 1, MAX_SHIFT);
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);

        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());

        return Duration.ofMillis(Math.min(exponential + jitter, maxDelayMs));
    }

    public Duration getBaseDelay() {
        return Duration.ofMillis(baseDelayMs);
    }

    public Duration getMaxDelay() {
        return Duration.ofMillis(maxDelayMs);
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
