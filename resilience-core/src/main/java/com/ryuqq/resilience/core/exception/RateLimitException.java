package com.ryuqq.resilience.core.exception;

/**
 * Rate Limit 초과 (재시도 가능).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RateLimitException extends TransientServiceException {

    public RateLimitException(String message) {
        super(message);
    }

    public RateLimitException(String message, Throwable cause) {
        super(message, cause);
    }
}
