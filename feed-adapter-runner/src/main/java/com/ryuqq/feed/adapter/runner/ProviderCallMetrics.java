package com.ryuqq.feed.adapter.runner;

import com.ryuqq.feed.application.orchestrator.ProviderCallStats;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * provider 하나의 외부 호출 누적 카운터.
 *
 * <p>워커 스레드들이 동시에 기록하므로 모든 값은 lock 없이 갱신됩니다.
 * {@link #snapshot()} 은 필드별로 읽으므로 필드 사이의 순간적인 불일치는 허용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class ProviderCallMetrics {

    private final LongAdder calls = new LongAdder();
    private final LongAdder failures = new LongAdder();
    private final LongAdder retries = new LongAdder();
    private final LongAdder fallbacks = new LongAdder();
    private final LongAdder totalLatencyNanos = new LongAdder();
    private final AtomicLong maxLatencyNanos = new AtomicLong();

    void recordCall(long latencyNanos, boolean success) {
        long latency = Math.max(0, latencyNanos);
        calls.increment();
        if (!success) {
            failures.increment();
        }
        totalLatencyNanos.add(latency);
        maxLatencyNanos.accumulateAndGet(latency, Math::max);
    }

    void recordRetry() {
        retries.increment();
    }

    void recordFallback() {
        fallbacks.increment();
    }

    ProviderCallStats snapshot() {
        long callCount = calls.sum();
        long failureCount = Math.min(failures.sum(), callCount);
        Duration mean = callCount == 0 ? Duration.ZERO : Duration.ofNanos(totalLatencyNanos.sum() / callCount);
        return new ProviderCallStats(
            callCount,
            failureCount,
            retries.sum(),
            fallbacks.sum(),
            mean,
            Duration.ofNanos(maxLatencyNanos.get())
        );
    }
}
