package com.ryuqq.resilience.adapter.runner;

/**
 * 재시도 발생 알림.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RetryListener {

    RetryListener NONE = (operationName, attempt, delayMs, cause) -> { };

    /**
     * 다음 시도 직전 호출.
     *
     * @param operationName operation 이름
     * @param attempt 실패한 시도 번호 (1부터 시작)
     * @param delayMs 다음 시도까지 대기 시간 (밀리초)
     * @param cause 실패 원인
     */
    void onRetry(String operationName, int attempt, long delayMs, Throwable cause);
}
