package com.ryuqq.resilience.application.orchestrator;

import com.ryuqq.resilience.core.operation.AsyncFallback;
import com.ryuqq.resilience.core.operation.AsyncOperation;
import com.ryuqq.resilience.core.operation.Fallback;
import com.ryuqq.resilience.core.operation.Operation;

/**
 * operation 하나에 Resilience 정책을 적용하는 decorator.
 *
 * <p>{@link ResilienceOrchestrator#withResilience(String)} 계열 메서드가 반환하며,
 * 동기/비동기 경로는 감싸는 시점에 메서드 선택으로 결정됩니다.
 * 반환된 operation은 원래 operation과 같은 입력/결과 타입을 유지합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Operation&lt;String, String&gt; summarize = orchestrator
 *     .withResilience("ai_summarize", ResilienceStrategy.AGGRESSIVE)
 *     .decorate(client::summarize, text -&gt; "요약을 생성할 수 없습니다");
 *
 * AsyncOperation&lt;String, Result&gt; scan = orchestrator
 *     .withResilience("ai_scan")
 *     .decorateAsync(client::scanAsync);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResilienceDecorator {

    /**
     * 대상 operation 이름.
     *
     * @return operation 이름
     */
    String operationName();

    /**
     * 동기 operation 감싸기 (fallback 없음).
     *
     * <p>최종 실패 시 영구 오류는 원래 예외 그대로, 재시도 소진은
     * {@link com.ryuqq.resilience.core.exception.RetryExhaustedException},
     * Circuit OPEN은 {@link com.ryuqq.resilience.core.exception.ServiceUnavailableException}으로 전파됩니다.</p>
     *
     * @param operation 원래 operation
     * @param <T> 입력 타입
     * @param <R> 결과 타입
     * @return Resilience 정책이 적용된 operation
     * @throws IllegalArgumentException operation이 null인 경우
     */
    <T, R> Operation<T, R> decorate(Operation<T, R> operation);

    /**
     * 동기 operation 감싸기.
     *
     * @param operation 원래 operation
     * @param fallback 최종 실패 시 원래 입력으로 호출되는 fallback
     * @param <T> 입력 타입
     * @param <R> 결과 타입
     * @return Resilience 정책이 적용된 operation
     * @throws IllegalArgumentException operation 또는 fallback이 null인 경우
     */
    <T, R> Operation<T, R> decorate(Operation<T, R> operation, Fallback<T, R> fallback);

    /**
     * 비동기 operation 감싸기 (fallback 없음).
     *
     * <p>재시도 대기는 호출 스레드를 점유하지 않습니다.</p>
     *
     * @param operation 원래 operation
     * @param <T> 입력 타입
     * @param <R> 결과 타입
     * @return Resilience 정책이 적용된 operation
     * @throws IllegalArgumentException operation이 null인 경우
     */
    <T, R> AsyncOperation<T, R> decorateAsync(AsyncOperation<T, R> operation);

    /**
     * 비동기 operation 감싸기.
     *
     * <p>동기 fallback은 {@link AsyncFallback#of(Fallback)}로 변환하여 전달할 수 있습니다.</p>
     *
     * @param operation 원래 operation
     * @param fallback 최종 실패 시 원래 입력으로 호출되는 fallback
     * @param <T> 입력 타입
     * @param <R> 결과 타입
     * @return Resilience 정책이 적용된 operation
     * @throws IllegalArgumentException operation 또는 fallback이 null인 경우
     */
    <T, R> AsyncOperation<T, R> decorateAsync(AsyncOperation<T, R> operation, AsyncFallback<T, R> fallback);
}
