package com.ryuqq.resilience.testkit.time;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 테스트에서 직접 시간을 진행시키는 {@link Clock}.
 *
 * <p>Circuit Breaker 복구 시간이나 재시도 총 시간 제한을 실제 대기 없이 검증할 때 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private volatile Instant now;
    private final ZoneId zone;

    /**
     * 시작 시각을 지정하여 생성 (UTC).
     *
     * @param start 시작 시각
     * @throws IllegalArgumentException start가 null인 경우
     */
    public MutableClock(Instant start) {
        this(start, ZoneOffset.UTC);
    }

    private MutableClock(Instant start, ZoneId zone) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = start;
        this.zone = zone;
    }

    /**
     * 시간 진행.
     *
     * @param duration 진행할 시간 (음수 불가)
     * @throws IllegalArgumentException duration이 null이거나 음수인 경우
     */
    public void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be non-negative");
        }
        synchronized (this) {
            now = now.plus(duration);
        }
    }

    /**
     * 초 단위 시간 진행.
     *
     * @param seconds 진행할 초
     */
    public void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(now, zone);
    }

    @Override
    public Instant instant() {
        return now;
    }
}
