package com.ryuqq.resilience.core.exception;

/**
 * 재시도 가능한 외부 서비스 실패.
 *
 * <p>operation이 실패를 명시적으로 일시적 실패로 표시할 때 사용합니다.
 * 기본 분류기는 이 예외를 항상 재시도 대상으로 분류합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TransientServiceException extends ResilienceException {

    public TransientServiceException(String message) {
        super(message);
    }

    public TransientServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
