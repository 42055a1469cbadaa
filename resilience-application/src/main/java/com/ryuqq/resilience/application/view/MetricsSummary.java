package com.ryuqq.resilience.application.view;

/**
 * metrics 보고서 요약.
 *
 * @param totalOperations metrics가 있는 operation 수
 * @param totalCircuitBreakers Circuit Breaker 수
 * @param healthyCircuitBreakers OPEN이 아닌 Circuit Breaker 수
 * @param timestamp 생성 시각 (ISO-8601)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MetricsSummary(
    int totalOperations,
    int totalCircuitBreakers,
    int healthyCircuitBreakers,
    String timestamp
) {
}
