package com.ryuqq.resilience.core.operation;

/**
 * 동기(blocking) operation.
 *
 * <p>외부 서비스 호출처럼 실패할 수 있는 작업을 나타냅니다.
 * 여러 인자가 필요하면 record 하나로 묶어 전달합니다.</p>
 *
 * @param <T> 입력 타입
 * @param <R> 결과 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Operation<T, R> {

    /**
     * operation 실행.
     *
     * @param input 입력
     * @return 결과
     * @throws Exception 실행 실패 시
     */
    R apply(T input) throws Exception;
}
