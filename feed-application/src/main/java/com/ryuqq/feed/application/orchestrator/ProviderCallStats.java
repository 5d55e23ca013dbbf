package com.ryuqq.feed.application.orchestrator;

import java.time.Duration;

/**
 * provider 단위 외부 호출 통계.
 *
 * <p>호출 수와 지연 시간은 실제로 나간 외부 호출만 집계합니다 (재시도 포함).
 * {@code fallbacks} 는 이 provider 의 요청이 stale 응답으로 끝난 호출자 수입니다.</p>
 *
 * @param calls 외부 호출 수
 * @param failures 실패한 외부 호출 수 (제한 시간 초과 포함)
 * @param retries 예약된 재시도 수
 * @param fallbacks stale 로 응답한 호출 수
 * @param meanLatency 평균 호출 지연 시간
 * @param maxLatency 최대 호출 지연 시간
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ProviderCallStats(
    long calls,
    long failures,
    long retries,
    long fallbacks,
    Duration meanLatency,
    Duration maxLatency
) {

    public ProviderCallStats {
        if (calls < 0 || failures < 0 || retries < 0 || fallbacks < 0) {
            throw new IllegalArgumentException("counters cannot be negative");
        }
        if (failures > calls) {
            throw new IllegalArgumentException(
                "failures cannot exceed calls (calls: " + calls + ", failures: " + failures + ")");
        }
        meanLatency = meanLatency == null ? Duration.ZERO : meanLatency;
        maxLatency = maxLatency == null ? Duration.ZERO : maxLatency;
    }

    /**
     * 성공률. 호출이 없으면 0.
     *
     * @return 0.0 ~ 1.0
     */
    public double successRate() {
        return calls == 0 ? 0.0 : (double) (calls - failures) / calls;
    }
}
