package com.ryuqq.feed.core.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 이벤트 근접도 기반 TTL 정책.
 *
 * <p>이벤트(경기 시작 등)가 가까울수록 데이터가 빠르게 변하므로 짧은 TTL 을 부여합니다.
 * 순수 함수이며, 경계값은 설정으로 주입됩니다.</p>
 *
 * <p><strong>기본 테이블:</strong></p>
 * <pre>
 * 이벤트까지 남은 시간   TTL
 * ------------------   ----
 * &lt; 1시간              2분
 * &lt; 6시간              15분
 * &lt; 24시간             30분
 * 그 외 / 알 수 없음     60분
 * </pre>
 *
 * <p>이미 시작된 이벤트(남은 시간이 음수)는 가장 짧은 구간으로 취급합니다.</p>
 *
 * @param thresholds 오름차순 정렬된 구간 목록
 * @param fallbackTtl 어느 구간에도 속하지 않거나 이벤트 시각을 모를 때의 TTL
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TtlPolicy(List<Threshold> thresholds, Duration fallbackTtl) {

    /**
     * 단일 구간: 남은 시간이 {@code within} 미만이면 {@code ttl} 적용.
     *
     * @param within 구간 상한 (배타)
     * @param ttl 적용 TTL
     */
    public record Threshold(Duration within, Duration ttl) {

        public Threshold {
            if (within == null || within.isNegative() || within.isZero()) {
                throw new IllegalArgumentException("within must be positive (current: " + within + ")");
            }
            if (ttl == null || ttl.isNegative() || ttl.isZero()) {
                throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
            }
        }
    }

    /**
     * Compact constructor with validation.
     *
     * <p>구간은 {@code within} 오름차순으로 정렬되어 저장됩니다.</p>
     *
     * @throws IllegalArgumentException thresholds 가 null 이거나 fallbackTtl 이 양수가 아닌 경우
     */
    public TtlPolicy {
        if (thresholds == null) {
            throw new IllegalArgumentException("thresholds cannot be null");
        }
        if (fallbackTtl == null || fallbackTtl.isNegative() || fallbackTtl.isZero()) {
            throw new IllegalArgumentException("fallbackTtl must be positive (current: " + fallbackTtl + ")");
        }
        List<Threshold> ordered = new ArrayList<>(thresholds);
        ordered.sort(Comparator.comparing(Threshold::within));
        thresholds = List.copyOf(ordered);
    }

    /**
     * 기본 테이블 (1h/2m, 6h/15m, 24h/30m, 그 외 60m).
     *
     * @return 기본 TtlPolicy
     */
    public static TtlPolicy defaults() {
        return new TtlPolicy(
            List.of(
                new Threshold(Duration.ofHours(1), Duration.ofMinutes(2)),
                new Threshold(Duration.ofHours(6), Duration.ofMinutes(15)),
                new Threshold(Duration.ofHours(24), Duration.ofMinutes(30))
            ),
            Duration.ofMinutes(60)
        );
    }

    /**
     * TTL 계산.
     *
     * @param eventTime 관련 이벤트 시각 (알 수 없으면 null)
     * @param now 기준 시각
     * @return 적용할 TTL
     */
    public Duration ttlFor(Instant eventTime, Instant now) {
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
        if (eventTime == null) {
            return fallbackTtl;
        }

        Duration untilEvent = Duration.between(now, eventTime);
        for (Threshold threshold : thresholds) {
            if (untilEvent.compareTo(threshold.within()) < 0) {
                return threshold.ttl();
            }
        }
        return fallbackTtl;
    }

    public TtlPolicy withFallbackTtl(Duration newFallbackTtl) {
        return new TtlPolicy(thresholds, newFallbackTtl);
    }

    public TtlPolicy withThresholds(List<Threshold> newThresholds) {
        return new TtlPolicy(newThresholds, fallbackTtl);
    }
}
