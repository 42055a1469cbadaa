package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.core.exception.PermanentServiceException;
import com.ryuqq.resilience.core.exception.TransientServiceException;
import com.ryuqq.resilience.core.operation.Operation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Fallback Contract Test.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("Fallback Contract")
class FallbackContractTest extends AbstractContractTest {

    @Test
    void 재시도_소진_후_fallback은_원래_입력을_받는다() throws Exception {
        // given
        List<String> fallbackInputs = new ArrayList<>();
        Operation<String, String> op = orchestrator.withResilience("quote").decorate(
            alwaysFailing(new TransientServiceException("busy"), new AtomicInteger()),
            input -> {
                fallbackInputs.add(input);
                return "cached:" + input;
            }
        );

        // when
        String result = op.apply("AAPL");

        // then
        assertThat(result).isEqualTo("cached:AAPL");
        assertThat(fallbackInputs).containsExactly("AAPL");
        assertMetrics("quote", 1, 0, 1);
    }

    @Test
    void OPEN_거부에도_fallback이_적용된다() throws Exception {
        // given
        forceOpen("quote");
        AtomicInteger calls = new AtomicInteger();
        Operation<String, String> op = orchestrator.withResilience("quote").decorate(
            failingTimes(0, IllegalStateException::new, "live", calls),
            input -> "cached"
        );

        // when
        String result = op.apply("AAPL");

        // then
        assertThat(result).isEqualTo("cached");
        assertThat(calls.get()).isZero();
    }

    @Test
    void fallback이_없으면_원래_예외를_그대로_던진다() {
        // given
        PermanentServiceException failure = new PermanentServiceException("rejected");
        Operation<String, String> op = orchestrator.withResilience("quote")
            .decorate(alwaysFailing(failure, new AtomicInteger()));

        // when & then
        assertThatThrownBy(() -> op.apply("AAPL")).isSameAs(failure);
    }

    @Test
    void fallback이_실패하면_fallback_예외에_원래_예외가_suppressed로_붙는다() {
        // given
        PermanentServiceException failure = new PermanentServiceException("rejected");
        IllegalStateException fallbackFailure = new IllegalStateException("cache miss");
        Operation<String, String> op = orchestrator.withResilience("quote").decorate(
            alwaysFailing(failure, new AtomicInteger()),
            input -> {
                throw fallbackFailure;
            }
        );

        // when & then
        assertThatThrownBy(() -> op.apply("AAPL"))
            .isSameAs(fallbackFailure)
            .satisfies(e -> assertThat(e.getSuppressed()).containsExactly(failure));
    }

    @Test
    void 성공하면_fallback을_호출하지_않는다() throws Exception {
        // given
        AtomicInteger fallbackCalls = new AtomicInteger();
        Operation<String, String> op = orchestrator.withResilience("quote").decorate(
            input -> "live",
            input -> {
                fallbackCalls.incrementAndGet();
                return "cached";
            }
        );

        // when
        String result = op.apply("AAPL");

        // then
        assertThat(result).isEqualTo("live");
        assertThat(fallbackCalls.get()).isZero();
    }
}
