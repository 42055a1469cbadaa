package com.ryuqq.resilience.core.exception;

/**
 * 재시도해도 성공할 수 없는 외부 서비스 실패.
 *
 * <p>잘못된 입력, 지원하지 않는 요청, 인증 실패 등에 사용합니다.
 * 기본 분류기는 이 예외를 재시도하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PermanentServiceException extends ResilienceException {

    public PermanentServiceException(String message) {
        super(message);
    }

    public PermanentServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
