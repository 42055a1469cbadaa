package com.ryuqq.resilience.application.view;

import java.util.List;

/**
 * 시스템 건강 상태.
 *
 * <p>OPEN 상태의 Circuit Breaker가 하나라도 있으면 unhealthy입니다.
 * HALF_OPEN은 복구 진행 중이므로 healthy로 간주합니다.
 * CLOSED 상태의 breaker는 두 목록 어디에도 포함되지 않습니다.</p>
 *
 * @param healthy 건강 여부
 * @param openCircuitBreakers OPEN 상태 operation 이름 (정렬됨)
 * @param halfOpenCircuitBreakers HALF_OPEN 상태 operation 이름 (정렬됨)
 * @param totalCircuitBreakers Circuit Breaker 수
 * @param totalOperations metrics가 있는 operation 수
 * @param timestamp 생성 시각 (ISO-8601)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record HealthStatus(
    boolean healthy,
    List<String> openCircuitBreakers,
    List<String> halfOpenCircuitBreakers,
    int totalCircuitBreakers,
    int totalOperations,
    String timestamp
) {

    public HealthStatus {
        if (openCircuitBreakers == null) {
            throw new IllegalArgumentException("openCircuitBreakers cannot be null");
        }
        if (halfOpenCircuitBreakers == null) {
            throw new IllegalArgumentException("halfOpenCircuitBreakers cannot be null");
        }
        openCircuitBreakers = List.copyOf(openCircuitBreakers);
        halfOpenCircuitBreakers = List.copyOf(halfOpenCircuitBreakers);
    }
}
