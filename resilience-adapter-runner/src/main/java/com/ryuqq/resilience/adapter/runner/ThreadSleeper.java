package com.ryuqq.resilience.adapter.runner;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

/**
 * 실제 시간으로 대기하는 {@link Sleeper}.
 *
 * <p>비동기 대기는 {@link CompletableFuture#delayedExecutor(long, TimeUnit)}를 사용하므로
 * 대기 동안 어떤 스레드도 점유하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ThreadSleeper implements Sleeper {

    @Override
    public void sleep(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }

    @Override
    public CompletionStage<Void> sleepAsync(long millis) {
        if (millis <= 0) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> { }, CompletableFuture.delayedExecutor(millis, TimeUnit.MILLISECONDS));
    }
}
