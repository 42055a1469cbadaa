package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.application.view.MetricsReport;
import com.ryuqq.resilience.application.view.MetricsView;
import com.ryuqq.resilience.core.exception.PermanentServiceException;
import com.ryuqq.resilience.core.metrics.ResilienceMetrics;
import com.ryuqq.resilience.core.operation.Operation;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Metrics Contract Test.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("Metrics Contract")
class MetricsContractTest extends AbstractContractTest {

    @Test
    void 성공_호출은_total과_success를_기록하고_시각을_남긴다() throws Exception {
        // given
        AtomicInteger calls = new AtomicInteger();
        Operation<String, String> op = orchestrator.withResilience("profile")
            .decorate(failingTimes(0, IllegalStateException::new, "ok", calls));

        // when
        op.apply("a");
        op.apply("b");

        // then
        assertMetrics("profile", 2, 2, 0);
        ResilienceMetrics metrics = orchestrator.getMetrics("profile");
        assertThat(metrics.getLastSuccess()).isEqualTo(START);
        assertThat(metrics.getLastFailure()).isNull();
        assertThat(metrics.snapshot().successRate()).isEqualTo(100.0);
    }

    @Test
    void operation별_metrics는_서로_독립적이다() throws Exception {
        // given
        Operation<String, String> opA = orchestrator.withResilience("op_a").decorate(input -> "a");
        Operation<String, String> opB = orchestrator.withResilience("op_b")
            .decorate(alwaysFailing(new PermanentServiceException("b failed"), new AtomicInteger()));

        // when
        opA.apply("x");
        opA.apply("y");
        assertThatThrownBy(() -> opB.apply("z")).isInstanceOf(PermanentServiceException.class);

        // then
        assertMetrics("op_a", 2, 2, 0);
        assertMetrics("op_b", 1, 0, 1);
    }

    @Test
    void 특정_operation_reset은_같은_인스턴스를_0으로_되돌리고_다른_operation은_유지한다() throws Exception {
        // given
        Operation<String, String> opA = orchestrator.withResilience("op_a").decorate(input -> "a");
        Operation<String, String> opB = orchestrator.withResilience("op_b").decorate(input -> "b");
        opA.apply("x");
        opB.apply("y");
        ResilienceMetrics heldByCaller = orchestrator.getMetrics("op_a");

        // when
        orchestrator.resetMetrics("op_a");

        // then
        assertThat(orchestrator.getMetrics("op_a")).isSameAs(heldByCaller);
        assertThat(heldByCaller.getTotalCalls()).isZero();
        assertMetrics("op_b", 1, 1, 0);
    }

    @Test
    void 전체_reset은_breaker_상태를_바꾸지_않는다() {
        // given
        forceOpen("inventory");

        // when
        orchestrator.resetMetrics();

        // then
        assertMetrics("inventory", 0, 0, 0);
        assertCircuitState("inventory", CircuitBreakerState.OPEN);
        assertThat(orchestrator.findCircuitBreaker("inventory").orElseThrow().getMetrics().getTotalCalls())
            .isZero();
    }

    @Test
    void null_이름으로_reset하면_모든_operation을_초기화한다() throws Exception {
        // given
        orchestrator.withResilience("op_a").decorate(input -> "a").apply("x");
        orchestrator.withResilience("op_b").decorate(input -> "b").apply("y");

        // when
        orchestrator.resetMetrics(null);

        // then
        assertMetrics("op_a", 0, 0, 0);
        assertMetrics("op_b", 0, 0, 0);
    }

    @Test
    void 전체_metrics_보고서는_operation과_breaker를_이름순으로_담는다() throws Exception {
        // given
        orchestrator.withResilience("zeta").decorate(input -> "z").apply("x");
        forceOpen("alpha");

        // when
        MetricsReport report = orchestrator.getAllMetrics();

        // then
        assertThat(report.operations()).containsOnlyKeys("alpha", "zeta");
        assertThat(report.operations().keySet()).containsExactly("alpha", "zeta");
        assertThat(report.circuitBreakers().get("alpha").state()).isEqualTo("open");
        assertThat(report.circuitBreakers().get("zeta").state()).isEqualTo("closed");
        assertThat(report.summary().totalOperations()).isEqualTo(2);
        assertThat(report.summary().totalCircuitBreakers()).isEqualTo(2);
        assertThat(report.summary().healthyCircuitBreakers()).isEqualTo(1);
        assertThat(report.timestamp()).isEqualTo("2026-01-01T00:00:00Z");

        MetricsView zeta = report.operations().get("zeta");
        assertThat(zeta.totalCalls()).isEqualTo(1);
        assertThat(zeta.successRate()).isEqualTo(100.0);
        assertThat(zeta.lastSuccess()).isEqualTo("2026-01-01T00:00:00Z");
    }
}
