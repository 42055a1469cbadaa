package com.ryuqq.resilience.core.exception;

/**
 * 일시적 실패로 재시도를 모두 소진했을 때 발생.
 *
 * <p>마지막 시도의 예외를 cause로 가집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RetryExhaustedException extends ResilienceException {

    private final String operationName;
    private final int attempts;

    public RetryExhaustedException(String operationName, int attempts, Throwable lastFailure) {
        super("Operation '" + operationName + "' failed after " + attempts + " attempt(s)", lastFailure);
        this.operationName = operationName;
        this.attempts = attempts;
    }

    public String getOperationName() {
        return operationName;
    }

    /**
     * 실제 수행된 시도 횟수.
     *
     * @return 시도 횟수
     */
    public int getAttempts() {
        return attempts;
    }
}
