package com.ryuqq.resilience.core.operation;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 비동기 fallback.
 *
 * <p>동기 fallback은 {@link #of(Fallback)}로 변환하여 비동기 operation에 사용할 수 있으므로,
 * 호출자는 fallback의 호출 방식을 알 필요가 없습니다.</p>
 *
 * @param <T> 입력 타입
 * @param <R> 결과 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AsyncFallback<T, R> {

    /**
     * 대체 결과 생성.
     *
     * @param input 원래 호출의 입력
     * @return 대체 결과 stage
     */
    CompletionStage<R> apply(T input);

    /**
     * 동기 fallback을 비동기 fallback으로 변환.
     *
     * <p>동기 fallback이 던진 예외는 예외적으로 완료된 stage가 됩니다.</p>
     *
     * @param fallback 동기 fallback
     * @param <T> 입력 타입
     * @param <R> 결과 타입
     * @return AsyncFallback
     * @throws IllegalArgumentException fallback이 null인 경우
     */
    static <T, R> AsyncFallback<T, R> of(Fallback<T, R> fallback) {
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }
        return input -> {
            try {
                return CompletableFuture.completedFuture(fallback.apply(input));
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }
}
