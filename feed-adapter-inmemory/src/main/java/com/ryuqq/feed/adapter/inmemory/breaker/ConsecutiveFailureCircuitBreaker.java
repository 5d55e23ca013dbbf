package com.ryuqq.feed.adapter.inmemory.breaker;

import com.ryuqq.feed.core.model.Endpoint;
import com.ryuqq.feed.core.protection.BreakerSnapshot;
import com.ryuqq.feed.core.protection.CircuitBreaker;
import com.ryuqq.feed.core.protection.CircuitBreakerConfig;
import com.ryuqq.feed.core.protection.CircuitBreakerState;

import java.time.Clock;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory consecutive-failure implementation of {@link CircuitBreaker}.
 *
 * <p>Each endpoint owns an independent circuit. Its configuration is resolved once, when the
 * circuit is created, in this order:</p>
 * <ol>
 *   <li>exact endpoint value ({@code odds_api/americanfootball_nfl/odds})</li>
 *   <li>provider name ({@code odds_api})</li>
 *   <li>the default configuration</li>
 * </ol>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * CircuitBreaker breaker = new ConsecutiveFailureCircuitBreaker(
 *     Clock.systemUTC(),
 *     Map.of("odds_api", CircuitBreakerConfig.of(3, Duration.ofSeconds(120))),
 *     CircuitBreakerConfig.defaults()
 * );
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConsecutiveFailureCircuitBreaker implements CircuitBreaker {

    private final Clock clock;
    private final Map<String, CircuitBreakerConfig> overrides;
    private final CircuitBreakerConfig defaultConfig;
    private final ConcurrentHashMap<Endpoint, EndpointCircuit> circuits = new ConcurrentHashMap<>();

    /**
     * Creates a circuit breaker.
     *
     * @param clock time source for cooldown tracking
     * @param overrides configuration per endpoint value or provider name
     * @param defaultConfig configuration for everything else
     * @throws IllegalArgumentException if any argument is null
     */
    public ConsecutiveFailureCircuitBreaker(
        Clock clock,
        Map<String, CircuitBreakerConfig> overrides,
        CircuitBreakerConfig defaultConfig
    ) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (overrides == null) {
            throw new IllegalArgumentException("overrides cannot be null");
        }
        if (defaultConfig == null) {
            throw new IllegalArgumentException("defaultConfig cannot be null");
        }
        this.clock = clock;
        this.overrides = Map.copyOf(overrides);
        this.defaultConfig = defaultConfig;
    }

    @Override
    public boolean allow(Endpoint endpoint) {
        return circuit(endpoint).allow(clock.instant());
    }

    @Override
    public void recordSuccess(Endpoint endpoint) {
        circuit(endpoint).recordSuccess();
    }

    @Override
    public void recordFailure(Endpoint endpoint, Throwable throwable) {
        circuit(endpoint).recordFailure(clock.instant(), throwable);
    }

    @Override
    public CircuitBreakerState getState(Endpoint endpoint) {
        return circuit(endpoint).state();
    }

    @Override
    public void reset(Endpoint endpoint) {
        circuit(endpoint).reset();
    }

    @Override
    public Map<Endpoint, BreakerSnapshot> snapshot() {
        Map<Endpoint, BreakerSnapshot> snapshots = new LinkedHashMap<>();
        circuits.entrySet().stream()
            .sorted(Map.Entry.comparingByKey(Comparator.comparing(Endpoint::getValue)))
            .forEach(entry -> snapshots.put(entry.getKey(), entry.getValue().snapshot()));
        return Collections.unmodifiableMap(snapshots);
    }

    /**
     * Resolves the configuration that applies to the endpoint.
     *
     * @param endpoint the endpoint
     * @return endpoint override, provider override or the default
     */
    public CircuitBreakerConfig configFor(Endpoint endpoint) {
        CircuitBreakerConfig config = overrides.get(endpoint.getValue());
        if (config == null) {
            config = overrides.get(endpoint.provider());
        }
        return config != null ? config : defaultConfig;
    }

    private EndpointCircuit circuit(Endpoint endpoint) {
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
        return circuits.computeIfAbsent(endpoint, e -> new EndpointCircuit(e, configFor(e)));
    }
}
