package com.ryuqq.resilience.core.config;

/**
 * 재시도 설정 (불변 record).
 *
 * <p>Retry Engine이 사용하는 지수 백오프, jitter, 중단 조건을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최대 시도 횟수, 최초 호출 포함 (기본 3, 1~20)</li>
 *   <li>maxDelaySeconds: 첫 시도 이후 재시도를 허용하는 총 시간 (기본 60초, 1~3600)</li>
 *   <li>exponentialMultiplier: 지수 백오프 배수 (기본 1.0, 0.1~10.0)</li>
 *   <li>exponentialMin: 최소 대기 시간 (기본 2.0초, 0.1~60.0)</li>
 *   <li>exponentialMax: 최대 대기 시간 (기본 10.0초, 1.0~3600.0)</li>
 *   <li>jitter: jitter 적용 여부 (기본 true)</li>
 *   <li>jitterMax: jitter 상한 (기본 2.0초, 0.1~60.0)</li>
 * </ul>
 *
 * <p><strong>대기 시간 계산:</strong></p>
 * <pre>
 * delay = clamp(exponentialMin, exponentialMultiplier * 2^(attempt-1), exponentialMax)
 *       + (jitter ? random(0, jitterMax) : 0)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수
 * @param maxDelaySeconds 재시도 총 허용 시간 (초)
 * @param exponentialMultiplier 지수 백오프 배수
 * @param exponentialMin 최소 대기 시간 (초)
 * @param exponentialMax 최대 대기 시간 (초)
 * @param jitter jitter 적용 여부
 * @param jitterMax jitter 상한 (초)
 */
public record RetryConfig(
    int maxAttempts,
    int maxDelaySeconds,
    double exponentialMultiplier,
    double exponentialMin,
    double exponentialMax,
    boolean jitter,
    double jitterMax
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, maxDelaySeconds=60, multiplier=1.0,
     * min=2.0, max=10.0, jitter=true, jitterMax=2.0</p>
     */
    public RetryConfig() {
        this(3, 60, 1.0, 2.0, 10.0, true, 2.0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (maxAttempts < 1 || maxAttempts > 20) {
            throw new IllegalArgumentException(
                "maxAttempts must be between 1 and 20 (current: " + maxAttempts + ")"
            );
        }
        if (maxDelaySeconds < 1 || maxDelaySeconds > 3600) {
            throw new IllegalArgumentException(
                "maxDelaySeconds must be between 1 and 3600 (current: " + maxDelaySeconds + ")"
            );
        }
        requireRange("exponentialMultiplier", exponentialMultiplier, 0.1, 10.0);
        requireRange("exponentialMin", exponentialMin, 0.1, 60.0);
        requireRange("exponentialMax", exponentialMax, 1.0, 3600.0);
        requireRange("jitterMax", jitterMax, 0.1, 60.0);
        if (exponentialMin > exponentialMax) {
            throw new IllegalArgumentException(
                "exponentialMin must be <= exponentialMax (min: " + exponentialMin + ", max: " + exponentialMax + ")"
            );
        }
    }

    private static void requireRange(String name, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new IllegalArgumentException(
                name + " must be between " + min + " and " + max + " (current: " + value + ")"
            );
        }
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(maxAttempts, maxDelaySeconds, exponentialMultiplier, exponentialMin, exponentialMax, jitter, jitterMax);
    }

    /**
     * maxDelaySeconds만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withMaxDelaySeconds(int maxDelaySeconds) {
        return new RetryConfig(maxAttempts, maxDelaySeconds, exponentialMultiplier, exponentialMin, exponentialMax, jitter, jitterMax);
    }

    /**
     * 백오프 파라미터(multiplier, min, max)만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withBackoff(double exponentialMultiplier, double exponentialMin, double exponentialMax) {
        return new RetryConfig(maxAttempts, maxDelaySeconds, exponentialMultiplier, exponentialMin, exponentialMax, jitter, jitterMax);
    }

    /**
     * jitter 설정만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withJitter(boolean jitter, double jitterMax) {
        return new RetryConfig(maxAttempts, maxDelaySeconds, exponentialMultiplier, exponentialMin, exponentialMax, jitter, jitterMax);
    }
}
