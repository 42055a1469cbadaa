package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.config.CircuitBreakerConfig;
import com.ryuqq.resilience.core.metrics.MetricsSnapshot;

import java.time.Instant;

/**
 * 특정 시점의 Circuit Breaker 상태 (불변).
 *
 * @param name operation 이름
 * @param state 상태
 * @param config 설정
 * @param consecutiveFailures 현재 연속 실패 수
 * @param stateChangedAt 마지막 상태 전이 시각 (전이 이력이 없으면 생성 시각)
 * @param metrics Circuit Breaker 자체 metrics
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CircuitBreakerSnapshot(
    String name,
    CircuitBreakerState state,
    CircuitBreakerConfig config,
    int consecutiveFailures,
    Instant stateChangedAt,
    MetricsSnapshot metrics
) {

    public CircuitBreakerSnapshot {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
    }

    public boolean isOpen() {
        return state == CircuitBreakerState.OPEN;
    }
}
