/**
 * In-memory token bucket rate limiting.
 *
 * <p>{@link com.ryuqq.feed.adapter.inmemory.ratelimit.TokenBucketRateLimiter} keeps one bucket per
 * provider. Budgets live in process memory and start full after a restart.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.feed.adapter.inmemory.ratelimit;
