package com.ryuqq.resilience.core.config;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failureThreshold: OPEN 전이까지 허용하는 연속 실패 횟수 (기본 5, 1~100)</li>
 *   <li>recoveryTimeoutSeconds: OPEN 이후 복구 시험 호출을 허용하기까지 대기 시간 (기본 60초, 1~3600)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param failureThreshold 연속 실패 임계값
 * @param recoveryTimeoutSeconds 복구 대기 시간 (초)
 */
public record CircuitBreakerConfig(int failureThreshold, int recoveryTimeoutSeconds) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failureThreshold=5, recoveryTimeoutSeconds=60</p>
     */
    public CircuitBreakerConfig() {
        this(5, 60);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (failureThreshold < 1 || failureThreshold > 100) {
            throw new IllegalArgumentException(
                "failureThreshold must be between 1 and 100 (current: " + failureThreshold + ")"
            );
        }
        if (recoveryTimeoutSeconds < 1 || recoveryTimeoutSeconds > 3600) {
            throw new IllegalArgumentException(
                "recoveryTimeoutSeconds must be between 1 and 3600 (current: " + recoveryTimeoutSeconds + ")"
            );
        }
    }

    /**
     * failureThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeoutSeconds);
    }

    /**
     * recoveryTimeoutSeconds만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withRecoveryTimeoutSeconds(int recoveryTimeoutSeconds) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeoutSeconds);
    }
}
