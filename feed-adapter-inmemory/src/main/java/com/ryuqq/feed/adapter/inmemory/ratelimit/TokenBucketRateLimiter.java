package com.ryuqq.feed.adapter.inmemory.ratelimit;

import com.ryuqq.feed.core.protection.BudgetSnapshot;
import com.ryuqq.feed.core.protection.RateLimitStatus;
import com.ryuqq.feed.core.protection.RateLimiter;
import com.ryuqq.feed.core.protection.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory token bucket implementation of {@link RateLimiter}.
 *
 * <p>One {@link TokenBucket} per provider, created on first access with the configured limits.
 * Providers without explicit limits get the fallback configuration and a warning is logged
 * once, when their bucket is created.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>{@link ConcurrentHashMap#computeIfAbsent} creates each bucket exactly once</li>
 *   <li>Each bucket serializes its own refill and consumption</li>
 *   <li>Different providers never contend</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * RateLimiter limiter = new TokenBucketRateLimiter(
 *     Clock.systemUTC(),
 *     Map.of("odds_api", RateLimiterConfig.perPeriod(500, Duration.ofDays(30))),
 *     RateLimiterConfig.perDay(100)
 * );
 *
 * if (limiter.check("odds_api", 1)) {
 *     limiter.consume("odds_api", 1);
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TokenBucketRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private final Clock clock;
    private final Map<String, RateLimiterConfig> providerConfigs;
    private final RateLimiterConfig fallbackConfig;
    private final ConcurrentHashMap<String, TokenBucket> buckets = new ConcurrentHashMap<>();

    /**
     * Creates a rate limiter.
     *
     * @param clock time source for lazy refill
     * @param providerConfigs limits per provider name
     * @param fallbackConfig limits for providers missing from {@code providerConfigs}
     * @throws IllegalArgumentException if any argument is null
     */
    public TokenBucketRateLimiter(
        Clock clock,
        Map<String, RateLimiterConfig> providerConfigs,
        RateLimiterConfig fallbackConfig
    ) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (providerConfigs == null) {
            throw new IllegalArgumentException("providerConfigs cannot be null");
        }
        if (fallbackConfig == null) {
            throw new IllegalArgumentException("fallbackConfig cannot be null");
        }
        this.clock = clock;
        this.providerConfigs = Map.copyOf(providerConfigs);
        this.fallbackConfig = fallbackConfig;
    }

    @Override
    public boolean check(String provider, int tokens) {
        validateTokens(tokens);
        return bucket(provider).hasTokens(tokens, clock.instant());
    }

    @Override
    public boolean consume(String provider, int tokens) {
        validateTokens(tokens);
        boolean consumed = bucket(provider).tryConsume(tokens, clock.instant());
        if (!consumed) {
            log.debug("Rate limit budget exhausted for provider={}", provider);
        }
        return consumed;
    }

    @Override
    public double remaining(String provider) {
        return bucket(provider).available(clock.instant());
    }

    @Override
    public RateLimitStatus status(String provider) {
        TokenBucket bucket = bucket(provider);
        return RateLimitStatus.of(bucket.available(clock.instant()), bucket.config().capacity());
    }

    @Override
    public void reset(String provider) {
        bucket(provider).refillToCapacity(clock.instant());
        log.info("Rate limit budget reset for provider={}", provider);
    }

    @Override
    public RateLimiterConfig getConfig(String provider) {
        return providerConfigs.getOrDefault(provider, fallbackConfig);
    }

    @Override
    public Map<String, BudgetSnapshot> snapshot() {
        Map<String, BudgetSnapshot> snapshots = new TreeMap<>();
        buckets.forEach((provider, bucket) -> {
            double remaining = bucket.available(clock.instant());
            RateLimiterConfig config = bucket.config();
            snapshots.put(provider, new BudgetSnapshot(
                provider,
                remaining,
                config.capacity(),
                config.refillRatePerSecond(),
                RateLimitStatus.of(remaining, config.capacity())
            ));
        });
        return Collections.unmodifiableMap(snapshots);
    }

    private TokenBucket bucket(String provider) {
        if (provider == null || provider.isBlank()) {
            throw new IllegalArgumentException("provider cannot be null or blank");
        }
        return buckets.computeIfAbsent(provider, this::newBucket);
    }

    private TokenBucket newBucket(String provider) {
        RateLimiterConfig config = providerConfigs.get(provider);
        if (config == null) {
            log.warn("No rate limit configured for provider={}, using fallback capacity={} refill/s={}",
                provider, fallbackConfig.capacity(), fallbackConfig.refillRatePerSecond());
            config = fallbackConfig;
        }
        return new TokenBucket(config, clock.instant());
    }

    private static void validateTokens(int tokens) {
        if (tokens <= 0) {
            throw new IllegalArgumentException("tokens must be positive (current: " + tokens + ")");
        }
    }
}
