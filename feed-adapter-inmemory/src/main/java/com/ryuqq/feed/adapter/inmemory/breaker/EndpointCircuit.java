package com.ryuqq.feed.adapter.inmemory.breaker;

import com.ryuqq.feed.core.model.Endpoint;
import com.ryuqq.feed.core.protection.BreakerSnapshot;
import com.ryuqq.feed.core.protection.CircuitBreakerConfig;
import com.ryuqq.feed.core.protection.CircuitBreakerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Circuit state of a single endpoint.
 *
 * <p>Every transition happens inside a {@code synchronized} method, so the check that grants
 * the HALF_OPEN trial and the transition itself are one atomic step.</p>
 *
 * <p><strong>Trial bookkeeping:</strong></p>
 * <ul>
 *   <li>{@code trialGrantedAt} is set when the single HALF_OPEN trial is handed out</li>
 *   <li>If the trial never reports back within one more cooldown, the next caller gets a new trial</li>
 *   <li>A failed trial multiplies the cooldown, a successful one restores the configured cooldown</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class EndpointCircuit {

    private static final Logger log = LoggerFactory.getLogger(EndpointCircuit.class);

    private final Endpoint endpoint;
    private final CircuitBreakerConfig config;

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private Instant trialGrantedAt;
    private Duration cooldown;

    EndpointCircuit(Endpoint endpoint, CircuitBreakerConfig config) {
        this.endpoint = endpoint;
        this.config = config;
        this.cooldown = config.cooldown();
    }

    synchronized boolean allow(Instant now) {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (elapsed(openedAt, now).compareTo(cooldown) < 0) {
                    return false;
                }
                state = CircuitBreakerState.HALF_OPEN;
                trialGrantedAt = now;
                log.info("Circuit HALF_OPEN for endpoint={}, granting trial request", endpoint);
                return true;
            case HALF_OPEN:
                if (trialGrantedAt != null && elapsed(trialGrantedAt, now).compareTo(cooldown) >= 0) {
                    log.warn("Trial request for endpoint={} never reported back, granting a new trial", endpoint);
                    trialGrantedAt = now;
                    return true;
                }
                return false;
            default:
                throw new IllegalStateException("Unknown circuit state: " + state);
        }
    }

    synchronized void recordSuccess() {
        if (state == CircuitBreakerState.HALF_OPEN) {
            log.info("Circuit CLOSED for endpoint={} after successful trial", endpoint);
            close();
        } else if (state == CircuitBreakerState.CLOSED) {
            consecutiveFailures = 0;
        }
    }

    synchronized void recordFailure(Instant now, Throwable throwable) {
        consecutiveFailures++;
        if (state == CircuitBreakerState.HALF_OPEN) {
            cooldown = config.nextCooldown(cooldown);
            open(now);
            log.warn("Circuit re-OPENED for endpoint={} after failed trial, cooldown={}",
                endpoint, cooldown, throwable);
        } else if (state == CircuitBreakerState.CLOSED && consecutiveFailures >= config.failureThreshold()) {
            open(now);
            log.warn("Circuit OPENED for endpoint={} after {} consecutive failures, cooldown={}",
                endpoint, consecutiveFailures, cooldown, throwable);
        }
    }

    synchronized void reset() {
        close();
    }

    synchronized CircuitBreakerState state() {
        return state;
    }

    synchronized BreakerSnapshot snapshot() {
        return new BreakerSnapshot(endpoint, state, consecutiveFailures, openedAt, cooldown);
    }

    private void open(Instant now) {
        state = CircuitBreakerState.OPEN;
        openedAt = now;
        trialGrantedAt = null;
    }

    private void close() {
        state = CircuitBreakerState.CLOSED;
        consecutiveFailures = 0;
        openedAt = null;
        trialGrantedAt = null;
        cooldown = config.cooldown();
    }

    private static Duration elapsed(Instant since, Instant now) {
        return Duration.between(since, now);
    }
}
