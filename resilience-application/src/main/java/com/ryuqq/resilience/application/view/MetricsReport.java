package com.ryuqq.resilience.application.view;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 전체 metrics 보고서.
 *
 * <p>두 맵은 operation 이름 순으로 정렬된 읽기 전용 복사본입니다.</p>
 *
 * @param operations operation 이름 → metrics
 * @param circuitBreakers operation 이름 → Circuit Breaker
 * @param summary 요약
 * @param timestamp 생성 시각 (ISO-8601)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MetricsReport(
    Map<String, MetricsView> operations,
    Map<String, CircuitBreakerView> circuitBreakers,
    MetricsSummary summary,
    String timestamp
) {

    public MetricsReport {
        if (operations == null) {
            throw new IllegalArgumentException("operations cannot be null");
        }
        if (circuitBreakers == null) {
            throw new IllegalArgumentException("circuitBreakers cannot be null");
        }
        if (summary == null) {
            throw new IllegalArgumentException("summary cannot be null");
        }
        operations = Collections.unmodifiableMap(new TreeMap<>(operations));
        circuitBreakers = Collections.unmodifiableMap(new TreeMap<>(circuitBreakers));
    }
}
