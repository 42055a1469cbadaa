package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.config.CircuitBreakerConfig;
import com.ryuqq.resilience.core.metrics.ResilienceMetrics;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerPermit;
import com.ryuqq.resilience.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;

import java.time.Instant;
import java.util.Optional;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>enableCircuitBreaker=false인 호출에 사용됩니다.
 * 모든 요청을 허용하며, 상태와 metrics를 기록하지 않고 registry에도 등록되지 않습니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>tryAcquire(): 항상 {@link CircuitBreakerPermit#UNTRACKED} 반환</li>
 *   <li>recordSuccess(): 아무 동작 안 함</li>
 *   <li>recordFailure(): 아무 동작 안 함</li>
 *   <li>getState(): 항상 CLOSED 반환</li>
 *   <li>reset(): 아무 동작 안 함</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private final String name;
    private final ResilienceMetrics metrics = new ResilienceMetrics();

    public NoOpCircuitBreaker(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Optional<CircuitBreakerPermit> tryAcquire() {
        return Optional.of(CircuitBreakerPermit.UNTRACKED);
    }

    @Override
    public void recordSuccess(CircuitBreakerPermit permit) {
        // NoOp
    }

    @Override
    public void recordFailure(CircuitBreakerPermit permit, Throwable throwable) {
        // NoOp
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public ResilienceMetrics getMetrics() {
        return metrics;
    }

    @Override
    public CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(
            name, CircuitBreakerState.CLOSED, new CircuitBreakerConfig(), 0, Instant.EPOCH, metrics.snapshot()
        );
    }

    @Override
    public void reset() {
        // NoOp
    }
}
