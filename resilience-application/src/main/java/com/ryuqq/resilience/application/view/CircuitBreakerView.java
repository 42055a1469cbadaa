package com.ryuqq.resilience.application.view;

import com.ryuqq.resilience.core.protection.CircuitBreakerSnapshot;

/**
 * 외부 노출용 Circuit Breaker 표현.
 *
 * @param state 현재 상태 ("closed", "open", "half_open")
 * @param failureThreshold OPEN 전이 임계값
 * @param recoveryTimeout 복구 대기 시간 (초)
 * @param consecutiveFailures 현재 연속 실패 수
 * @param stateChangedAt 마지막 상태 전이 시각 (ISO-8601)
 * @param metrics breaker 자체 metrics
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CircuitBreakerView(
    String state,
    int failureThreshold,
    int recoveryTimeout,
    int consecutiveFailures,
    String stateChangedAt,
    MetricsView metrics
) {

    /**
     * snapshot으로부터 생성.
     *
     * @param snapshot Circuit Breaker snapshot
     * @return CircuitBreakerView
     * @throws IllegalArgumentException snapshot이 null인 경우
     */
    public static CircuitBreakerView from(CircuitBreakerSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        return new CircuitBreakerView(
            snapshot.state().value(),
            snapshot.config().failureThreshold(),
            snapshot.config().recoveryTimeoutSeconds(),
            snapshot.consecutiveFailures(),
            snapshot.stateChangedAt().toString(),
            MetricsView.from(snapshot.metrics())
        );
    }
}
