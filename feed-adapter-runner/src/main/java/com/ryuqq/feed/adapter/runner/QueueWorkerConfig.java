package com.ryuqq.feed.adapter.runner;

import com.ryuqq.feed.application.config.GatewayProperties;

import java.time.Duration;

/**
 * QueueWorkerRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>workerCount: 큐를 소비하는 워커 스레드 수 (기본 4)</li>
 *   <li>maxAttempts: 요청당 최대 외부 호출 횟수, 첫 시도 포함 (기본 3)</li>
 *   <li>upstreamTimeout: 외부 호출 1회 제한 시간 (기본 10초)</li>
 *   <li>backoffBase / backoffMax / jitterFactor: 재시도 간격 (기본 1초 / 30초 / 0.1)</li>
 *   <li>maxCallerWait: 호출자가 결과를 기다리는 최대 시간 (기본 60초)</li>
 *   <li>conserveBudgetForLowPriority: 예산이 CRITICAL 이하일 때 캐시가 있는 LOW 요청은 갱신하지 않음 (기본 true)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>실시간 폴러가 많은 경우: workerCount 증가, upstreamTimeout 감소</li>
 *   <li>할당량이 작은 provider: maxAttempts 감소 (재시도도 예산을 소비함)</li>
 *   <li>maxCallerWait 는 maxAttempts × upstreamTimeout + 백오프 합보다 크게 두는 것이 좋음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param workerCount 워커 스레드 수 (1 이상)
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param upstreamTimeout 외부 호출 제한 시간 (양수)
 * @param backoffBase 기본 백오프 (양수)
 * @param backoffMax 최대 백오프 (backoffBase 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 * @param maxCallerWait 호출자 최대 대기 시간 (양수)
 * @param conserveBudgetForLowPriority LOW 우선순위 예산 보존 여부
 */
public record QueueWorkerConfig(
    int workerCount,
    int maxAttempts,
    Duration upstreamTimeout,
    Duration backoffBase,
    Duration backoffMax,
    double jitterFactor,
    Duration maxCallerWait,
    boolean conserveBudgetForLowPriority
) {

    /**
     * 기본 설정 생성자.
     */
    public QueueWorkerConfig() {
        this(4, 3, Duration.ofSeconds(10), Duration.ofSeconds(1), Duration.ofSeconds(30), 0.1,
            Duration.ofSeconds(60), true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public QueueWorkerConfig {
        if (workerCount <= 0) {
            throw new IllegalArgumentException(
                "workerCount must be positive (current: " + workerCount + ")"
            );
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        requirePositive("upstreamTimeout", upstreamTimeout);
        requirePositive("backoffBase", backoffBase);
        requirePositive("backoffMax", backoffMax);
        if (backoffMax.compareTo(backoffBase) < 0) {
            throw new IllegalArgumentException(
                "backoffMax must be >= backoffBase (base: " + backoffBase + ", max: " + backoffMax + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        requirePositive("maxCallerWait", maxCallerWait);
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }

    /**
     * {@code feed.worker.*} 설정으로 생성.
     *
     * @param properties 게이트웨이 설정
     * @return 설정
     */
    public static QueueWorkerConfig from(GatewayProperties properties) {
        return new QueueWorkerConfig(
            properties.workerCount(),
            properties.maxAttempts(),
            properties.upstreamTimeout(),
            properties.backoffBase(),
            properties.backoffMax(),
            properties.jitterFactor(),
            properties.maxCallerWait(),
            properties.conserveBudgetForLowPriority()
        );
    }

    /**
     * 설정값으로 BackoffCalculator 생성.
     *
     * @return BackoffCalculator
     */
    public BackoffCalculator newBackoffCalculator() {
        return new BackoffCalculator(backoffBase, backoffMax, jitterFactor);
    }

    public QueueWorkerConfig withWorkerCount(int workerCount) {
        return new QueueWorkerConfig(workerCount, maxAttempts, upstreamTimeout, backoffBase, backoffMax,
            jitterFactor, maxCallerWait, conserveBudgetForLowPriority);
    }

    public QueueWorkerConfig withMaxAttempts(int maxAttempts) {
        return new QueueWorkerConfig(workerCount, maxAttempts, upstreamTimeout, backoffBase, backoffMax,
            jitterFactor, maxCallerWait, conserveBudgetForLowPriority);
    }

    public QueueWorkerConfig withUpstreamTimeout(Duration upstreamTimeout) {
        return new QueueWorkerConfig(workerCount, maxAttempts, upstreamTimeout, backoffBase, backoffMax,
            jitterFactor, maxCallerWait, conserveBudgetForLowPriority);
    }

    /**
     * 백오프 설정만 변경한 새 인스턴스 생성.
     */
    public QueueWorkerConfig withBackoff(Duration backoffBase, Duration backoffMax, double jitterFactor) {
        return new QueueWorkerConfig(workerCount, maxAttempts, upstreamTimeout, backoffBase, backoffMax,
            jitterFactor, maxCallerWait, conserveBudgetForLowPriority);
    }

    public QueueWorkerConfig withMaxCallerWait(Duration maxCallerWait) {
        return new QueueWorkerConfig(workerCount, maxAttempts, upstreamTimeout, backoffBase, backoffMax,
            jitterFactor, maxCallerWait, conserveBudgetForLowPriority);
    }

    public QueueWorkerConfig withConserveBudgetForLowPriority(boolean conserveBudgetForLowPriority) {
        return new QueueWorkerConfig(workerCount, maxAttempts, upstreamTimeout, backoffBase, backoffMax,
            jitterFactor, maxCallerWait, conserveBudgetForLowPriority);
    }
}
