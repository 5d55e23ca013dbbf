package com.ryuqq.feed.core.protection.noop;

import com.ryuqq.feed.core.protection.BudgetSnapshot;
import com.ryuqq.feed.core.protection.RateLimitStatus;
import com.ryuqq.feed.core.protection.RateLimiter;
import com.ryuqq.feed.core.protection.RateLimiterConfig;

import java.util.Map;

/**
 * Rate Limiter NoOp 구현.
 *
 * <p>모든 요청을 항상 허용합니다.
 * 개발 및 테스트 환경에서 사용하거나, 예산 제한 없이 실행하고자 할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>check(), consume(): 항상 true 반환</li>
 *   <li>status(): 항상 OK 반환</li>
 *   <li>getConfig(): 무제한 설정 반환</li>
 *   <li>snapshot(): 빈 Map 반환</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpRateLimiter implements RateLimiter {

    private static final RateLimiterConfig UNLIMITED_CONFIG =
        new RateLimiterConfig(Long.MAX_VALUE, Double.MAX_VALUE);

    @Override
    public boolean check(String provider, int tokens) {
        return true;
    }

    @Override
    public boolean consume(String provider, int tokens) {
        return true;
    }

    @Override
    public double remaining(String provider) {
        return UNLIMITED_CONFIG.capacity();
    }

    @Override
    public RateLimitStatus status(String provider) {
        return RateLimitStatus.OK;
    }

    @Override
    public void reset(String provider) {
        // NoOp
    }

    @Override
    public RateLimiterConfig getConfig(String provider) {
        return UNLIMITED_CONFIG;
    }

    @Override
    public Map<String, BudgetSnapshot> snapshot() {
        return Map.of();
    }
}
