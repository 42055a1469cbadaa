package com.ryuqq.resilience.testkit.time;

import com.ryuqq.resilience.adapter.runner.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 대기 시간을 기록만 하고 즉시 반환하는 {@link Sleeper}.
 *
 * <p>{@link MutableClock}을 함께 넘기면 기록한 만큼 시계를 진행시켜
 * 재시도 총 시간 제한도 실제 대기 없이 검증할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RecordingSleeper implements Sleeper {

    private final List<Long> delays = Collections.synchronizedList(new ArrayList<>());
    private final MutableClock clock;

    /**
     * 시계를 진행시키지 않는 sleeper.
     */
    public RecordingSleeper() {
        this(null);
    }

    /**
     * 대기 시간만큼 시계를 진행시키는 sleeper.
     *
     * @param clock 진행시킬 시계 (nullable)
     */
    public RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public void sleep(long millis) {
        record(millis);
    }

    @Override
    public CompletionStage<Void> sleepAsync(long millis) {
        record(millis);
        return CompletableFuture.completedFuture(null);
    }

    /**
     * 기록된 대기 시간 목록.
     *
     * @return 대기 시간 (밀리초, 호출 순서, 복사본)
     */
    public List<Long> delays() {
        synchronized (delays) {
            return List.copyOf(delays);
        }
    }

    /**
     * 기록된 대기 횟수.
     *
     * @return 횟수
     */
    public int count() {
        return delays.size();
    }

    /**
     * 기록 초기화.
     */
    public void clear() {
        delays.clear();
    }

    private void record(long millis) {
        delays.add(millis);
        if (clock != null) {
            clock.advance(Duration.ofMillis(millis));
        }
    }
}
