package com.ryuqq.resilience.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CircuitBreakerConfig 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CircuitBreakerConfigTest {

    @Test
    void defaultConstructor_ThresholdFiveRecoverySixty() {
        // When
        CircuitBreakerConfig config = new CircuitBreakerConfig();

        // Then
        assertEquals(5, config.failureThreshold());
        assertEquals(60, config.recoveryTimeoutSeconds());
    }

    @Test
    void constructor_BoundaryValues_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> new CircuitBreakerConfig(1, 1));
        assertDoesNotThrow(() -> new CircuitBreakerConfig(100, 3600));
    }

    @Test
    void constructor_ThresholdOutOfRange_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new CircuitBreakerConfig(0, 60)
        );
        assertTrue(exception.getMessage().contains("failureThreshold"));
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreakerConfig(101, 60));
    }

    @Test
    void constructor_RecoveryOutOfRange_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreakerConfig(5, 0));
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreakerConfig(5, 3601));
    }

    @Test
    void withers_KeepOtherField() {
        // When
        CircuitBreakerConfig config = new CircuitBreakerConfig().withFailureThreshold(2).withRecoveryTimeoutSeconds(10);

        // Then
        assertEquals(new CircuitBreakerConfig(2, 10), config);
    }
}
