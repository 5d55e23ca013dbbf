/**
 * In-memory per-endpoint circuit breaking.
 *
 * <p>{@link com.ryuqq.feed.adapter.inmemory.breaker.ConsecutiveFailureCircuitBreaker} trips an
 * endpoint after a run of consecutive failures and lets exactly one trial request through once
 * the cooldown has elapsed.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.feed.adapter.inmemory.breaker;
