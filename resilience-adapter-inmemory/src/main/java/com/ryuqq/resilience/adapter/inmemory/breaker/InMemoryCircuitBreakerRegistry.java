package com.ryuqq.resilience.adapter.inmemory.breaker;

import com.ryuqq.resilience.core.config.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.spi.CircuitBreakerRegistry;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link CircuitBreakerRegistry}.
 *
 * <p>Breakers are created lazily with {@link ConcurrentHashMap#computeIfAbsent}, so concurrent
 * first calls for the same operation always observe a single instance. The configuration passed on
 * the first call wins; breakers live until the registry is discarded.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryCircuitBreakerRegistry implements CircuitBreakerRegistry {

    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Clock clock;

    /**
     * Creates a registry using the system UTC clock.
     */
    public InMemoryCircuitBreakerRegistry() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a registry with a custom clock (recovery timers).
     *
     * @param clock time source handed to every breaker
     * @throws IllegalArgumentException if clock is null
     */
    public InMemoryCircuitBreakerRegistry(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public CircuitBreaker getOrCreate(String operationName, CircuitBreakerConfig config) {
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return breakers.computeIfAbsent(operationName, name -> new CountingCircuitBreaker(name, config, clock));
    }

    @Override
    public Optional<CircuitBreaker> find(String operationName) {
        if (operationName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(breakers.get(operationName));
    }

    @Override
    public Map<String, CircuitBreaker> all() {
        return new TreeMap<>(breakers);
    }

    @Override
    public int size() {
        return breakers.size();
    }

    /**
     * Removes every breaker.
     *
     * <p>Intended for tests only.</p>
     */
    public void clear() {
        breakers.clear();
    }
}
