package com.ryuqq.resilience.core.exception;

/**
 * Resilience 계층 예외의 최상위 타입.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ResilienceException extends RuntimeException {

    public ResilienceException(String message) {
        super(message);
    }

    public ResilienceException(String message, Throwable cause) {
        super(message, cause);
    }
}
