package com.ryuqq.feed.adapter.inmemory.ratelimit;

import com.ryuqq.feed.core.protection.RateLimiterConfig;

import java.time.Duration;
import java.time.Instant;

/**
 * Token bucket state of a single provider.
 *
 * <p>Refill is computed lazily from the elapsed time since the last refill; no background
 * thread ever touches the bucket. All methods are {@code synchronized} so that refill and
 * consumption form one atomic step.</p>
 *
 * <p><strong>Invariants:</strong></p>
 * <ul>
 *   <li>{@code 0 <= tokens <= capacity}</li>
 *   <li>A failed {@link #tryConsume(int, Instant)} deducts nothing</li>
 *   <li>A clock that moves backwards refills nothing</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class TokenBucket {

    private final RateLimiterConfig config;
    private double tokens;
    private Instant lastRefill;

    TokenBucket(RateLimiterConfig config, Instant now) {
        this.config = config;
        this.tokens = config.capacity();
        this.lastRefill = now;
    }

    synchronized boolean hasTokens(int requested, Instant now) {
        refill(now);
        return tokens >= requested;
    }

    synchronized boolean tryConsume(int requested, Instant now) {
        refill(now);
        if (tokens < requested) {
            return false;
        }
        tokens -= requested;
        return true;
    }

    synchronized double available(Instant now) {
        refill(now);
        return tokens;
    }

    synchronized void refillToCapacity(Instant now) {
        tokens = config.capacity();
        lastRefill = now;
    }

    RateLimiterConfig config() {
        return config;
    }

    private void refill(Instant now) {
        if (!now.isAfter(lastRefill)) {
            return;
        }
        Duration elapsed = Duration.between(lastRefill, now);
        double elapsedSeconds = elapsed.getSeconds() + elapsed.getNano() / 1_000_000_000.0;
        tokens = Math.min(config.capacity(), tokens + elapsedSeconds * config.refillRatePerSecond());
        lastRefill = now;
    }
}
