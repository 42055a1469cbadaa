package com.ryuqq.resilience.core.operation;

import java.util.concurrent.CompletionStage;

/**
 * 비동기(non-blocking) operation.
 *
 * <p>실패는 예외적으로 완료된 {@link CompletionStage}로 전달하는 것이 원칙이지만,
 * {@link #apply(Object)}에서 직접 던진 예외도 실패로 처리됩니다.</p>
 *
 * @param <T> 입력 타입
 * @param <R> 결과 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AsyncOperation<T, R> {

    /**
     * operation 시작.
     *
     * @param input 입력
     * @return 결과 stage
     */
    CompletionStage<R> apply(T input);
}
