package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.operation.AsyncFallback;
import com.ryuqq.resilience.core.operation.Fallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 최종 실패 시 fallback 실행기.
 *
 * <p>fallback은 원래 호출의 입력을 그대로 받습니다. fallback이 없으면 실패를 변경 없이 전파합니다.
 * fallback 자체가 실패하면 그 예외가 전파되며, 원래 실패는 suppressed로 첨부됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FallbackExecutor {

    private static final Logger log = LoggerFactory.getLogger(FallbackExecutor.class);

    /**
     * 동기 fallback 실행.
     *
     * @param operationName operation 이름
     * @param fallback fallback (nullable)
     * @param input 원래 호출의 입력
     * @param failure 최종 실패
     * @param <T> 입력 타입
     * @param <R> 결과 타입
     * @return fallback 결과
     * @throws Exception fallback이 없으면 failure, fallback이 실패하면 그 예외
     */
    public <T, R> R execute(String operationName, Fallback<T, R> fallback, T input, Exception failure) throws Exception {
        if (fallback == null) {
            throw failure;
        }
        log.warn("Using fallback for operation '{}' after {}", operationName, describe(failure));
        try {
            return fallback.apply(input);
        } catch (Exception fallbackFailure) {
            log.error("Fallback for operation '{}' failed", operationName, fallbackFailure);
            attachOriginal(fallbackFailure, failure);
            throw fallbackFailure;
        }
    }

    /**
     * 비동기 fallback 실행.
     *
     * @param operationName operation 이름
     * @param fallback fallback (nullable)
     * @param input 원래 호출의 입력
     * @param failure 최종 실패
     * @param <T> 입력 타입
     * @param <R> 결과 타입
     * @return fallback 결과 future, fallback이 없으면 failure로 실패한 future
     */
    public <T, R> CompletableFuture<R> executeAsync(
        String operationName,
        AsyncFallback<T, R> fallback,
        T input,
        Throwable failure
    ) {
        if (fallback == null) {
            return CompletableFuture.failedFuture(failure);
        }
        log.warn("Using fallback for operation '{}' after {}", operationName, describe(failure));
        CompletionStage<R> stage;
        try {
            stage = fallback.apply(input);
        } catch (Throwable fallbackFailure) {
            stage = CompletableFuture.failedFuture(fallbackFailure);
        }
        if (stage == null) {
            stage = CompletableFuture.failedFuture(
                new IllegalStateException("Fallback for operation '" + operationName + "' returned null stage"));
        }

        CompletableFuture<R> result = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            log.error("Fallback for operation '{}' failed", operationName, error);
            attachOriginal(error, failure);
            result.completeExceptionally(error);
        });
        return result;
    }

    // a fallback that rethrows the original failure cannot suppress itself
    private static void attachOriginal(Throwable fallbackFailure, Throwable failure) {
        if (fallbackFailure != failure) {
            fallbackFailure.addSuppressed(failure);
        }
    }

    private static String describe(Throwable throwable) {
        return throwable.getClass().getSimpleName() + ": " + throwable.getMessage();
    }
}
