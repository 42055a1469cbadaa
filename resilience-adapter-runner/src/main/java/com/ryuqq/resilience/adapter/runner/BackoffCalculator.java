package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.config.RetryConfig;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 지수적으로 증가시키되, Jitter를 추가하여
 * Thundering Herd Problem을 방지합니다.</p>
 *
 * <p><strong>알고리즘 (초 단위):</strong></p>
 * <pre>
 * exponential = clamp(multiplier * 2^(attempt-1), exponentialMin, exponentialMax)
 * jitter = random(0, jitterMax)   (jitter 비활성 시 0)
 * delay = exponential + jitter
 * </pre>
 *
 * <p><strong>예시 (BALANCED: multiplier=1.0, min=2.0, max=10.0, jitterMax=2.0):</strong></p>
 * <ul>
 *   <li>attempt=1: clamp(1.0) = 2.0s + jitter(0-2s)</li>
 *   <li>attempt=2: clamp(2.0) = 2.0s + jitter(0-2s)</li>
 *   <li>attempt=3: clamp(4.0) = 4.0s + jitter(0-2s)</li>
 *   <li>attempt=5: clamp(16.0) = 10.0s + jitter(0-2s) (capped at exponentialMax)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private static final int MAX_EXPONENT = 30;

    private final RetryConfig config;
    private final DoubleSupplier random;

    /**
     * 기본 난수 생성기로 생성.
     *
     * @param config 재시도 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public BackoffCalculator(RetryConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 생성기를 지정하여 생성.
     *
     * @param config 재시도 설정
     * @param random [0.0, 1.0) 범위 난수 공급자
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public BackoffCalculator(RetryConfig config, DoubleSupplier random) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.config = config;
        this.random = random;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attemptCount 실패한 시도 횟수 (1부터 시작)
     * @return 다음 시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attemptCount가 양수가 아닌 경우
     */
    public long calculate(int attemptCount) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException(
                "attemptCount must be positive (current: " + attemptCount + ")"
            );
        }

        // 1. 지수적 백오프 (overflow 방지를 위해 지수 상한 적용)
        int exponent = Math.min(attemptCount - 1, MAX_EXPONENT);
        double exponential = config.exponentialMultiplier() * (1L << exponent);

        // 2. [min, max] 범위 제한
        double bounded = Math.max(config.exponentialMin(), Math.min(exponential, config.exponentialMax()));

        // 3. Jitter 추가 (0 ~ jitterMax)
        double jitter = config.jitter() ? config.jitterMax() * random.getAsDouble() : 0.0;

        return Math.round((bounded + jitter) * 1000.0);
    }

    /**
     * 재시도 설정 조회.
     *
     * @return 재시도 설정
     */
    public RetryConfig getConfig() {
        return config;
    }
}
