package com.ryuqq.resilience.adapter.runner;

import java.util.concurrent.CompletionStage;

/**
 * 재시도 대기 전략.
 *
 * <p>동기 경로는 호출 스레드를 멈추고, 비동기 경로는 스레드를 점유하지 않는
 * 지연 완료 stage를 반환해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Sleeper {

    /**
     * 현재 스레드 대기.
     *
     * @param millis 대기 시간 (밀리초)
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    void sleep(long millis) throws InterruptedException;

    /**
     * 비차단 대기.
     *
     * @param millis 대기 시간 (밀리초)
     * @return millis 이후 완료되는 stage
     */
    CompletionStage<Void> sleepAsync(long millis);
}
