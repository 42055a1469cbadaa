package com.ryuqq.resilience.core.config;

/**
 * 한 번의 호출에 적용되는 최종 Resilience 설정 (불변 record).
 *
 * <p>Configuration Resolver가 호출마다 결정하며, 결정된 이후에는 변경되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param strategy 설정의 출처가 된 전략
 * @param retryConfig 재시도 설정
 * @param circuitBreakerConfig Circuit Breaker 설정
 * @param enableRetry 재시도 활성화 여부
 * @param enableCircuitBreaker Circuit Breaker 활성화 여부
 */
public record ResilienceConfig(
    ResilienceStrategy strategy,
    RetryConfig retryConfig,
    CircuitBreakerConfig circuitBreakerConfig,
    boolean enableRetry,
    boolean enableCircuitBreaker
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 구성 요소가 null인 경우
     */
    public ResilienceConfig {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (retryConfig == null) {
            throw new IllegalArgumentException("retryConfig cannot be null");
        }
        if (circuitBreakerConfig == null) {
            throw new IllegalArgumentException("circuitBreakerConfig cannot be null");
        }
    }

    /**
     * 재시도와 Circuit Breaker를 모두 활성화한 설정 생성.
     *
     * @param strategy 전략
     * @param retryConfig 재시도 설정
     * @param circuitBreakerConfig Circuit Breaker 설정
     * @return ResilienceConfig
     */
    public static ResilienceConfig of(
        ResilienceStrategy strategy,
        RetryConfig retryConfig,
        CircuitBreakerConfig circuitBreakerConfig
    ) {
        return new ResilienceConfig(strategy, retryConfig, circuitBreakerConfig, true, true);
    }

    /**
     * retryConfig만 변경한 새 인스턴스 생성.
     */
    public ResilienceConfig withRetryConfig(RetryConfig retryConfig) {
        return new ResilienceConfig(strategy, retryConfig, circuitBreakerConfig, enableRetry, enableCircuitBreaker);
    }

    /**
     * circuitBreakerConfig만 변경한 새 인스턴스 생성.
     */
    public ResilienceConfig withCircuitBreakerConfig(CircuitBreakerConfig circuitBreakerConfig) {
        return new ResilienceConfig(strategy, retryConfig, circuitBreakerConfig, enableRetry, enableCircuitBreaker);
    }

    /**
     * enableRetry만 변경한 새 인스턴스 생성.
     */
    public ResilienceConfig withEnableRetry(boolean enableRetry) {
        return new ResilienceConfig(strategy, retryConfig, circuitBreakerConfig, enableRetry, enableCircuitBreaker);
    }

    /**
     * enableCircuitBreaker만 변경한 새 인스턴스 생성.
     */
    public ResilienceConfig withEnableCircuitBreaker(boolean enableCircuitBreaker) {
        return new ResilienceConfig(strategy, retryConfig, circuitBreakerConfig, enableRetry, enableCircuitBreaker);
    }
}
