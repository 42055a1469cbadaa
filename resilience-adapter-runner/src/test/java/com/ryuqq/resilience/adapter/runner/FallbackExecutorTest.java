package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.exception.RetryExhaustedException;
import com.ryuqq.resilience.core.exception.TransientServiceException;
import com.ryuqq.resilience.core.operation.AsyncFallback;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FallbackExecutorTest {

    private final FallbackExecutor executor = new FallbackExecutor();

    private final RetryExhaustedException failure =
        new RetryExhaustedException("op", 3, new TransientServiceException("busy"));

    @Test
    void fallback이_없으면_원래_예외를_그대로_던진다() {
        assertThatThrownBy(() -> executor.execute("op", null, "in", failure)).isSameAs(failure);
    }

    @Test
    void fallback은_원래_입력을_받는다() throws Exception {
        // given
        AtomicReference<String> received = new AtomicReference<>();

        // when
        String result = executor.execute("op", input -> {
            received.set(input);
            return "fallback:" + input;
        }, "payload-1", failure);

        // then
        assertThat(received.get()).isEqualTo("payload-1");
        assertThat(result).isEqualTo("fallback:payload-1");
    }

    @Test
    void fallback_실패시_fallback_예외에_원래_실패가_첨부된다() {
        IllegalStateException broken = new IllegalStateException("fallback broken");

        assertThatThrownBy(() -> executor.execute("op", input -> {
            throw broken;
        }, "in", failure))
            .isSameAs(broken)
            .satisfies(e -> assertThat(e.getSuppressed()).containsExactly(failure));
    }

    @Test
    void async_fallback이_없으면_실패한_future() {
        CompletableFuture<String> result = executor.executeAsync("op", null, "in", failure);

        assertThatThrownBy(result::join).hasCause(failure);
    }

    @Test
    void async_fallback은_원래_입력을_받는다() {
        CompletableFuture<String> result = executor.executeAsync(
            "op", input -> CompletableFuture.completedFuture("async:" + input), "in", failure);

        assertThat(result.join()).isEqualTo("async:in");
    }

    @Test
    void async_경로에서_동기_fallback_사용() {
        AsyncFallback<String, String> fallback = AsyncFallback.of(input -> "sync:" + input);

        CompletableFuture<String> result = executor.executeAsync("op", fallback, "in", failure);

        assertThat(result.join()).isEqualTo("sync:in");
    }

    @Test
    void async_fallback_실패() {
        IllegalStateException broken = new IllegalStateException("fallback broken");

        CompletableFuture<String> result = executor.executeAsync(
            "op", input -> CompletableFuture.failedFuture(broken), "in", failure);

        assertThatThrownBy(result::join).hasCause(broken);
        assertThat(broken.getSuppressed()).containsExactly(failure);
    }

    @Test
    void async_fallback이_원래_실패를_다시_던져도_future가_완료된다() {
        CompletableFuture<String> result = executor.executeAsync(
            "op", input -> CompletableFuture.failedFuture(failure), "in", failure);

        assertThat(result).isCompletedExceptionally();
        assertThatThrownBy(result::join).hasCause(failure);
        assertThat(failure.getSuppressed()).isEmpty();
    }

    @Test
    void async_fallback이_Error를_던져도_future로_전달된다() {
        AssertionError broken = new AssertionError("fallback invariant");

        CompletableFuture<String> result = executor.executeAsync("op", input -> {
            throw broken;
        }, "in", failure);

        assertThat(result).isCompletedExceptionally();
        assertThatThrownBy(result::join).hasCause(broken);
    }

    @Test
    void fallback이_원래_실패를_다시_던지면_그대로_전파된다() {
        assertThatThrownBy(() -> executor.execute("op", input -> {
            throw failure;
        }, "in", failure))
            .isSameAs(failure)
            .satisfies(e -> assertThat(e.getSuppressed()).isEmpty());
    }
}
