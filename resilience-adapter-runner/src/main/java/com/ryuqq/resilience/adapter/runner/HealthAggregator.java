package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.application.view.HealthStatus;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.spi.CircuitBreakerRegistry;
import com.ryuqq.resilience.core.spi.MetricsRegistry;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Circuit Breaker 상태 집계기.
 *
 * <p><strong>판정 규칙:</strong></p>
 * <ul>
 *   <li>OPEN 상태의 breaker가 하나라도 있으면 unhealthy</li>
 *   <li>HALF_OPEN은 복구 진행 중이므로 healthy</li>
 *   <li>breaker가 없으면 healthy</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HealthAggregator {

    private final CircuitBreakerRegistry circuitBreakers;
    private final MetricsRegistry metrics;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param circuitBreakers Circuit Breaker 테이블
     * @param metrics operation metrics 저장소
     * @param clock timestamp용 시계
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public HealthAggregator(CircuitBreakerRegistry circuitBreakers, MetricsRegistry metrics, Clock clock) {
        if (circuitBreakers == null) {
            throw new IllegalArgumentException("circuitBreakers cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.circuitBreakers = circuitBreakers;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * 건강 여부.
     *
     * @return OPEN breaker가 없으면 true
     */
    public boolean isHealthy() {
        for (CircuitBreaker breaker : circuitBreakers.all().values()) {
            if (breaker.getState() == CircuitBreakerState.OPEN) {
                return false;
            }
        }
        return true;
    }

    /**
     * 상태별 breaker 분류.
     *
     * <p>breaker마다 상태를 한 번만 읽으므로 하나의 이름은 최대 한 목록에만 나타납니다.</p>
     *
     * @return HealthStatus
     */
    public HealthStatus status() {
        Map<String, CircuitBreaker> all = circuitBreakers.all();
        List<String> open = new ArrayList<>();
        List<String> halfOpen = new ArrayList<>();

        for (Map.Entry<String, CircuitBreaker> entry : all.entrySet()) {
            CircuitBreakerState state = entry.getValue().getState();
            if (state == CircuitBreakerState.OPEN) {
                open.add(entry.getKey());
            } else if (state == CircuitBreakerState.HALF_OPEN) {
                halfOpen.add(entry.getKey());
            }
        }

        return new HealthStatus(
            open.isEmpty(),
            open,
            halfOpen,
            all.size(),
            metrics.size(),
            clock.instant().toString()
        );
    }
}
