package com.ryuqq.resilience.application.view;

import com.ryuqq.resilience.core.metrics.MetricsSnapshot;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * 외부 노출용 metrics 표현.
 *
 * <p>시각은 ISO-8601 문자열이며 기록이 없으면 null입니다.
 * 성공률/실패율은 소수점 둘째 자리까지 반올림된 백분율입니다.</p>
 *
 * @param totalCalls 전체 호출 수
 * @param successfulCalls 성공 호출 수
 * @param failedCalls 실패 호출 수
 * @param retryAttempts 재시도 횟수
 * @param circuitBreakerOpens OPEN 전이 횟수
 * @param circuitBreakerHalfOpens HALF_OPEN 전이 횟수
 * @param circuitBreakerCloses CLOSED 복구 횟수
 * @param successRate 성공률 (%)
 * @param failureRate 실패율 (%)
 * @param lastSuccess 마지막 성공 시각 (nullable)
 * @param lastFailure 마지막 실패 시각 (nullable)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MetricsView(
    long totalCalls,
    long successfulCalls,
    long failedCalls,
    long retryAttempts,
    long circuitBreakerOpens,
    long circuitBreakerHalfOpens,
    long circuitBreakerCloses,
    double successRate,
    double failureRate,
    String lastSuccess,
    String lastFailure
) {

    /**
     * snapshot으로부터 생성.
     *
     * @param snapshot metrics snapshot
     * @return MetricsView
     * @throws IllegalArgumentException snapshot이 null인 경우
     */
    public static MetricsView from(MetricsSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        return new MetricsView(
            snapshot.totalCalls(),
            snapshot.successfulCalls(),
            snapshot.failedCalls(),
            snapshot.retryAttempts(),
            snapshot.circuitBreakerOpens(),
            snapshot.circuitBreakerHalfOpens(),
            snapshot.circuitBreakerCloses(),
            round(snapshot.successRate()),
            round(snapshot.failureRate()),
            iso(snapshot.lastSuccess()),
            iso(snapshot.lastFailure())
        );
    }

    static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static String iso(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
