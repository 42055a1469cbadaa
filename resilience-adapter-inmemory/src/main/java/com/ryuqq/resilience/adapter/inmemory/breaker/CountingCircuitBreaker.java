package com.ryuqq.resilience.adapter.inmemory.breaker;

import com.ryuqq.resilience.core.config.CircuitBreakerConfig;
import com.ryuqq.resilience.core.metrics.ResilienceMetrics;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerPermit;
import com.ryuqq.resilience.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.statemachine.CircuitBreakerTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Consecutive-failure counting implementation of {@link CircuitBreaker}.
 *
 * <p>State, failure count and the trial-call slot are guarded by a per-instance lock, so breakers
 * for different operations never contend with each other.</p>
 *
 * <p><strong>State Machine:</strong></p>
 * <ul>
 *   <li>CLOSED: every call passes; a failure increments the consecutive failure count and
 *       the breaker opens once the count reaches {@code failureThreshold}; a success clears the count</li>
 *   <li>OPEN: calls are rejected until {@code recoveryTimeoutSeconds} have elapsed since opening;
 *       the first call after that moves the breaker to HALF_OPEN and becomes the trial call</li>
 *   <li>HALF_OPEN: only one trial call may be in flight; its success closes the breaker,
 *       its failure re-opens it and restarts the recovery timer</li>
 * </ul>
 *
 * <p>Every transition and reset starts a new generation. A {@link CircuitBreakerPermit} carries the
 * generation it was issued in, and an outcome reported with a permit from an earlier generation
 * only updates metrics. In HALF_OPEN only the permit marked as the trial call moves the state.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * CircuitBreaker cb = new CountingCircuitBreaker("ai_summarize", new CircuitBreakerConfig(3, 30), Clock.systemUTC());
 * cb.tryAcquire().ifPresent(permit -&gt; {
 *     try {
 *         call();
 *         cb.recordSuccess(permit);
 *     } catch (Exception e) {
 *         cb.recordFailure(permit, e);
 *     }
 * });
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CountingCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CountingCircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ResilienceMetrics metrics = new ResilienceMetrics();
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private boolean trialInFlight;
    private long generation;
    private Instant stateChangedAt;

    /**
     * Creates a new breaker in CLOSED state.
     *
     * @param name operation name
     * @param config thresholds
     * @param clock time source for the recovery timer
     * @throws IllegalArgumentException if any argument is null or name is blank
     */
    public CountingCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = name;
        this.config = config;
        this.clock = clock;
        this.stateChangedAt = clock.instant();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Optional<CircuitBreakerPermit> tryAcquire() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return Optional.of(new CircuitBreakerPermit(generation, false));
                case OPEN:
                    if (!recoveryTimeoutElapsed()) {
                        return Optional.empty();
                    }
                    transitionTo(CircuitBreakerState.HALF_OPEN);
                    trialInFlight = true;
                    return Optional.of(new CircuitBreakerPermit(generation, true));
                case HALF_OPEN:
                    if (trialInFlight) {
                        return Optional.empty();
                    }
                    trialInFlight = true;
                    return Optional.of(new CircuitBreakerPermit(generation, true));
                default:
                    throw new IllegalStateException("Unknown state: " + state);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordSuccess(CircuitBreakerPermit permit) {
        requirePermit(permit);
        lock.lock();
        try {
            metrics.recordSuccess(clock.instant());
            if (!isCurrent(permit)) {
                return;
            }
            if (state == CircuitBreakerState.HALF_OPEN) {
                trialInFlight = false;
                consecutiveFailures = 0;
                transitionTo(CircuitBreakerState.CLOSED);
            } else if (state == CircuitBreakerState.CLOSED) {
                consecutiveFailures = 0;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordFailure(CircuitBreakerPermit permit, Throwable throwable) {
        requirePermit(permit);
        lock.lock();
        try {
            metrics.recordFailure(clock.instant());
            if (!isCurrent(permit)) {
                log.debug("Circuit breaker '{}' ignored stale failure from generation {}: {}",
                    name, permit.generation(), describe(throwable));
                return;
            }
            if (state == CircuitBreakerState.HALF_OPEN) {
                trialInFlight = false;
                log.warn("Circuit breaker '{}' trial call failed: {}", name, describe(throwable));
                transitionTo(CircuitBreakerState.OPEN);
            } else if (state == CircuitBreakerState.CLOSED) {
                consecutiveFailures++;
                if (consecutiveFailures >= config.failureThreshold()) {
                    log.warn("Circuit breaker '{}' reached failure threshold {} (last: {})",
                        name, config.failureThreshold(), describe(throwable));
                    transitionTo(CircuitBreakerState.OPEN);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ResilienceMetrics getMetrics() {
        return metrics;
    }

    @Override
    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            return new CircuitBreakerSnapshot(name, state, config, consecutiveFailures, stateChangedAt, metrics.snapshot());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            CircuitBreakerState previous = state;
            state = CircuitBreakerTransition.reset(previous);
            consecutiveFailures = 0;
            trialInFlight = false;
            generation++;
            stateChangedAt = clock.instant();
            log.info("Circuit breaker '{}' reset: {} → {}", name, previous, state);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Configured thresholds.
     *
     * @return config used at creation
     */
    public CircuitBreakerConfig getConfig() {
        return config;
    }

    // caller must hold lock; in HALF_OPEN only the trial permit counts
    private boolean isCurrent(CircuitBreakerPermit permit) {
        if (permit.generation() != generation) {
            return false;
        }
        return state != CircuitBreakerState.HALF_OPEN || permit.trial();
    }

    private static void requirePermit(CircuitBreakerPermit permit) {
        if (permit == null) {
            throw new IllegalArgumentException("permit cannot be null");
        }
    }

    private boolean recoveryTimeoutElapsed() {
        Duration elapsed = Duration.between(stateChangedAt, clock.instant());
        return elapsed.compareTo(Duration.ofSeconds(config.recoveryTimeoutSeconds())) >= 0;
    }

    // caller must hold lock
    private void transitionTo(CircuitBreakerState next) {
        CircuitBreakerState previous = state;
        state = CircuitBreakerTransition.transition(previous, next);
        generation++;
        stateChangedAt = clock.instant();
        switch (next) {
            case OPEN -> metrics.recordCircuitBreakerOpen();
            case HALF_OPEN -> metrics.recordCircuitBreakerHalfOpen();
            case CLOSED -> metrics.recordCircuitBreakerClose();
        }
        log.info("Circuit breaker '{}' transitioned: {} → {}", name, previous, next);
    }

    private static String describe(Throwable throwable) {
        if (throwable == null) {
            return "unknown";
        }
        return throwable.getClass().getSimpleName() + ": " + throwable.getMessage();
    }
}
