package com.ryuqq.resilience.core.metrics;

import java.time.Instant;

/**
 * operation 단위 resilience counter.
 *
 * <p>operation 이름 하나당 하나의 인스턴스가 registry에 의해 소유되며,
 * 같은 이름으로 조회하면 항상 같은 인스턴스가 반환됩니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>모든 변경과 조회는 인스턴스 lock으로 직렬화됩니다 (인스턴스 간 경합 없음)</li>
 *   <li>{@link #recordSuccess(Instant)}/{@link #recordFailure(Instant)}는
 *       totalCalls와 결과 counter를 한 번에 증가시킵니다</li>
 *   <li>{@link #snapshot()}은 부분적으로 갱신된 값을 관찰하지 않습니다</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResilienceMetrics {

    private final Object lock = new Object();

    private long totalCalls;
    private long successfulCalls;
    private long failedCalls;
    private long retryAttempts;
    private long circuitBreakerOpens;
    private long circuitBreakerHalfOpens;
    private long circuitBreakerCloses;
    private Instant lastSuccess;
    private Instant lastFailure;

    /**
     * 성공한 호출 기록.
     *
     * @param at 성공 시각
     */
    public void recordSuccess(Instant at) {
        synchronized (lock) {
            totalCalls++;
            successfulCalls++;
            lastSuccess = at;
        }
    }

    /**
     * 실패한 호출 기록.
     *
     * @param at 실패 시각
     */
    public void recordFailure(Instant at) {
        synchronized (lock) {
            totalCalls++;
            failedCalls++;
            lastFailure = at;
        }
    }

    public void recordRetryAttempt() {
        synchronized (lock) {
            retryAttempts++;
        }
    }

    public void recordCircuitBreakerOpen() {
        synchronized (lock) {
            circuitBreakerOpens++;
        }
    }

    public void recordCircuitBreakerHalfOpen() {
        synchronized (lock) {
            circuitBreakerHalfOpens++;
        }
    }

    public void recordCircuitBreakerClose() {
        synchronized (lock) {
            circuitBreakerCloses++;
        }
    }

    /**
     * 모든 counter와 timestamp를 초기화.
     *
     * <p>인스턴스 자체는 유지되므로 이미 참조를 가진 호출자도 계속 같은 인스턴스에 기록합니다.</p>
     */
    public void reset() {
        synchronized (lock) {
            totalCalls = 0;
            successfulCalls = 0;
            failedCalls = 0;
            retryAttempts = 0;
            circuitBreakerOpens = 0;
            circuitBreakerHalfOpens = 0;
            circuitBreakerCloses = 0;
            lastSuccess = null;
            lastFailure = null;
        }
    }

    /**
     * 일관된 스냅샷 생성.
     *
     * @return MetricsSnapshot
     */
    public MetricsSnapshot snapshot() {
        synchronized (lock) {
            return new MetricsSnapshot(
                totalCalls,
                successfulCalls,
                failedCalls,
                retryAttempts,
                circuitBreakerOpens,
                circuitBreakerHalfOpens,
                circuitBreakerCloses,
                lastSuccess,
                lastFailure
            );
        }
    }

    public long getTotalCalls() {
        synchronized (lock) {
            return totalCalls;
        }
    }

    public long getSuccessfulCalls() {
        synchronized (lock) {
            return successfulCalls;
        }
    }

    public long getFailedCalls() {
        synchronized (lock) {
            return failedCalls;
        }
    }

    public long getRetryAttempts() {
        synchronized (lock) {
            return retryAttempts;
        }
    }

    public Instant getLastSuccess() {
        synchronized (lock) {
            return lastSuccess;
        }
    }

    public Instant getLastFailure() {
        synchronized (lock) {
            return lastFailure;
        }
    }

    @Override
    public String toString() {
        MetricsSnapshot s = snapshot();
        return "ResilienceMetrics{total=" + s.totalCalls()
            + ", success=" + s.successfulCalls()
            + ", failed=" + s.failedCalls()
            + ", retries=" + s.retryAttempts() + '}';
    }
}
