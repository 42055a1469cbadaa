package com.ryuqq.resilience.core.exception;

/**
 * HTTP 상태 코드를 가진 외부 서비스 호출 실패.
 *
 * <p>기본 분류기는 429와 5xx를 일시적 실패로, 그 외 상태 코드를 영구 실패로 분류합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ServiceCallException extends ResilienceException {

    private final int statusCode;

    public ServiceCallException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public ServiceCallException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * 응답 상태 코드.
     *
     * @return 상태 코드 (예: 503)
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * 서버 측 오류(5xx) 여부.
     *
     * @return 5xx이면 true
     */
    public boolean isServerError() {
        return statusCode >= 500 && statusCode <= 599;
    }
}
