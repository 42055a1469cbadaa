package com.ryuqq.resilience.core.exception;

import com.ryuqq.resilience.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker가 호출을 거부했을 때 발생.
 *
 * <p>이 예외가 발생한 경우 감싸진 operation은 실행되지 않았습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ServiceUnavailableException extends ResilienceException {

    private final String operationName;
    private final CircuitBreakerState state;

    public ServiceUnavailableException(String operationName, CircuitBreakerState state) {
        super("Circuit breaker is " + state + " for operation '" + operationName + "'");
        this.operationName = operationName;
        this.state = state;
    }

    public String getOperationName() {
        return operationName;
    }

    /**
     * 거부 시점의 Circuit Breaker 상태.
     *
     * @return OPEN 또는 HALF_OPEN (시험 호출 진행 중)
     */
    public CircuitBreakerState getState() {
        return state;
    }
}
