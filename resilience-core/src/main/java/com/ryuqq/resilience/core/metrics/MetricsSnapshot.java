package com.ryuqq.resilience.core.metrics;

import java.time.Instant;

/**
 * 특정 시점의 {@link ResilienceMetrics} 값 (불변).
 *
 * <p>하나의 lock 구간에서 복사되므로 counter 간 일관성이 보장됩니다.</p>
 *
 * @param totalCalls 전체 호출 수
 * @param successfulCalls 성공 호출 수
 * @param failedCalls 실패 호출 수
 * @param retryAttempts 재시도 횟수
 * @param circuitBreakerOpens OPEN 전이 횟수
 * @param circuitBreakerHalfOpens HALF_OPEN 전이 횟수
 * @param circuitBreakerCloses HALF_OPEN → CLOSED 복구 횟수
 * @param lastSuccess 마지막 성공 시각 (없으면 null)
 * @param lastFailure 마지막 실패 시각 (없으면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MetricsSnapshot(
    long totalCalls,
    long successfulCalls,
    long failedCalls,
    long retryAttempts,
    long circuitBreakerOpens,
    long circuitBreakerHalfOpens,
    long circuitBreakerCloses,
    Instant lastSuccess,
    Instant lastFailure
) {

    public static final MetricsSnapshot EMPTY = new MetricsSnapshot(0, 0, 0, 0, 0, 0, 0, null, null);

    /**
     * 성공률 (0.0 ~ 100.0). 호출이 없으면 0.0.
     *
     * @return 성공률 (%)
     */
    public double successRate() {
        return percentage(successfulCalls);
    }

    /**
     * 실패율 (0.0 ~ 100.0). 호출이 없으면 0.0.
     *
     * @return 실패율 (%)
     */
    public double failureRate() {
        return percentage(failedCalls);
    }

    private double percentage(long count) {
        if (totalCalls == 0) {
            return 0.0;
        }
        return (double) count / totalCalls * 100.0;
    }
}
