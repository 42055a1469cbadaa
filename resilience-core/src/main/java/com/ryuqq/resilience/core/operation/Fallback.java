package com.ryuqq.resilience.core.operation;

/**
 * 동기 fallback.
 *
 * <p>주 경로가 최종 실패했을 때 원래 호출과 동일한 입력으로 호출되며,
 * 반환값이 예외 대신 호출자에게 전달됩니다.</p>
 *
 * @param <T> 입력 타입
 * @param <R> 결과 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Fallback<T, R> {

    /**
     * 대체 결과 생성.
     *
     * @param input 원래 호출의 입력
     * @return 대체 결과
     * @throws Exception fallback 자체가 실패한 경우
     */
    R apply(T input) throws Exception;
}
