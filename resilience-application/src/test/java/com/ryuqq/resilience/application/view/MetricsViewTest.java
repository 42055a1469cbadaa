package com.ryuqq.resilience.application.view;

import com.ryuqq.resilience.core.config.CircuitBreakerConfig;
import com.ryuqq.resilience.core.metrics.MetricsSnapshot;
import com.ryuqq.resilience.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricsViewTest {

    private static final Instant AT = Instant.parse("2026-03-01T12:30:00Z");

    @Test
    void from_비율은_소수점_둘째자리_반올림() {
        // given: 1/3 성공
        MetricsSnapshot snapshot = new MetricsSnapshot(3, 1, 2, 4, 0, 0, 0, AT, null);

        // when
        MetricsView view = MetricsView.from(snapshot);

        // then
        assertThat(view.successRate()).isEqualTo(33.33);
        assertThat(view.failureRate()).isEqualTo(66.67);
        assertThat(view.retryAttempts()).isEqualTo(4);
    }

    @Test
    void from_시각은_ISO_문자열_없으면_null() {
        MetricsView view = MetricsView.from(new MetricsSnapshot(1, 1, 0, 0, 0, 0, 0, AT, null));

        assertThat(view.lastSuccess()).isEqualTo("2026-03-01T12:30:00Z");
        assertThat(view.lastFailure()).isNull();
    }

    @Test
    void from_호출이_없으면_비율_0() {
        MetricsView view = MetricsView.from(MetricsSnapshot.EMPTY);

        assertThat(view.successRate()).isZero();
        assertThat(view.failureRate()).isZero();
    }

    @Test
    void CircuitBreakerView_snapshot_변환() {
        // given
        CircuitBreakerSnapshot snapshot = new CircuitBreakerSnapshot(
            "ai_scan", CircuitBreakerState.HALF_OPEN, new CircuitBreakerConfig(3, 30), 0, AT, MetricsSnapshot.EMPTY
        );

        // when
        CircuitBreakerView view = CircuitBreakerView.from(snapshot);

        // then
        assertThat(view.state()).isEqualTo("half_open");
        assertThat(view.failureThreshold()).isEqualTo(3);
        assertThat(view.recoveryTimeout()).isEqualTo(30);
        assertThat(view.stateChangedAt()).isEqualTo("2026-03-01T12:30:00Z");
        assertThat(view.metrics().totalCalls()).isZero();
    }

    @Test
    void MetricsReport_맵은_정렬된_읽기전용_복사본() {
        // given
        Map<String, MetricsView> operations = new HashMap<>();
        operations.put("zeta", MetricsView.from(MetricsSnapshot.EMPTY));
        operations.put("alpha", MetricsView.from(MetricsSnapshot.EMPTY));

        // when
        MetricsReport report = new MetricsReport(
            operations, Map.of(), new MetricsSummary(2, 0, 0, AT.toString()), AT.toString()
        );
        operations.clear();

        // then
        assertThat(report.operations().keySet()).containsExactly("alpha", "zeta");
        assertThatThrownBy(() -> report.operations().clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void HealthStatus_목록은_복사본() {
        List<String> open = new ArrayList<>(List.of("op_a"));

        HealthStatus status = new HealthStatus(false, open, List.of(), 1, 1, AT.toString());
        open.add("op_b");

        assertThat(status.openCircuitBreakers()).containsExactly("op_a");
        assertThatThrownBy(() -> new HealthStatus(true, null, List.of(), 0, 0, AT.toString()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
