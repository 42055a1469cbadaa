package com.ryuqq.resilience.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ResilienceConfig 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ResilienceConfigTest {

    @Test
    void of_EnablesRetryAndCircuitBreaker() {
        // When
        ResilienceConfig config = ResilienceConfig.of(
            ResilienceStrategy.BALANCED, new RetryConfig(), new CircuitBreakerConfig()
        );

        // Then
        assertTrue(config.enableRetry());
        assertTrue(config.enableCircuitBreaker());
    }

    @Test
    void withEnableFlags_ChangeOnlyTheFlag() {
        // Given
        ResilienceConfig config = ResiliencePresets.forStrategy(ResilienceStrategy.AGGRESSIVE);

        // When
        ResilienceConfig noRetry = config.withEnableRetry(false);
        ResilienceConfig noBreaker = config.withEnableCircuitBreaker(false);

        // Then
        assertFalse(noRetry.enableRetry());
        assertTrue(noRetry.enableCircuitBreaker());
        assertFalse(noBreaker.enableCircuitBreaker());
        assertEquals(config.retryConfig(), noBreaker.retryConfig());
        assertTrue(config.enableRetry());
    }

    @Test
    void constructor_NullParts_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> ResilienceConfig.of(null, new RetryConfig(), new CircuitBreakerConfig()));
        assertThrows(IllegalArgumentException.class,
            () -> ResilienceConfig.of(ResilienceStrategy.BALANCED, null, new CircuitBreakerConfig()));
        assertThrows(IllegalArgumentException.class,
            () -> ResilienceConfig.of(ResilienceStrategy.BALANCED, new RetryConfig(), null));
    }
}
