package com.ryuqq.resilience.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RetryConfig 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RetryConfigTest {

    @Test
    void defaultConstructor_UsesDocumentedDefaults() {
        // When
        RetryConfig config = new RetryConfig();

        // Then
        assertEquals(3, config.maxAttempts());
        assertEquals(60, config.maxDelaySeconds());
        assertEquals(1.0, config.exponentialMultiplier());
        assertEquals(2.0, config.exponentialMin());
        assertEquals(10.0, config.exponentialMax());
        assertTrue(config.jitter());
        assertEquals(2.0, config.jitterMax());
    }

    @Test
    void constructor_BoundaryValues_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> new RetryConfig(1, 1, 0.1, 0.1, 1.0, false, 0.1));
        assertDoesNotThrow(() -> new RetryConfig(20, 3600, 10.0, 60.0, 3600.0, true, 60.0));
    }

    @Test
    void constructor_MaxAttemptsOutOfRange_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RetryConfig().withMaxAttempts(0)
        );
        assertTrue(exception.getMessage().contains("maxAttempts"));
        assertThrows(IllegalArgumentException.class, () -> new RetryConfig().withMaxAttempts(21));
    }

    @Test
    void constructor_MaxDelayOutOfRange_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new RetryConfig().withMaxDelaySeconds(0));
        assertThrows(IllegalArgumentException.class, () -> new RetryConfig().withMaxDelaySeconds(3601));
    }

    @Test
    void constructor_BackoffOutOfRange_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new RetryConfig().withBackoff(0.05, 2.0, 10.0));
        assertThrows(IllegalArgumentException.class, () -> new RetryConfig().withBackoff(1.0, 0.0, 10.0));
        assertThrows(IllegalArgumentException.class, () -> new RetryConfig().withBackoff(1.0, 2.0, 4000.0));
        assertThrows(IllegalArgumentException.class, () -> new RetryConfig().withBackoff(Double.NaN, 2.0, 10.0));
    }

    @Test
    void constructor_MinGreaterThanMax_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RetryConfig().withBackoff(1.0, 30.0, 10.0)
        );
        assertTrue(exception.getMessage().contains("exponentialMin must be <= exponentialMax"));
    }

    @Test
    void constructor_JitterMaxOutOfRange_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new RetryConfig().withJitter(true, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new RetryConfig().withJitter(true, 61.0));
    }

    @Test
    void withers_ReturnNewInstance() {
        // Given
        RetryConfig original = new RetryConfig();

        // When
        RetryConfig changed = original.withMaxAttempts(5).withJitter(false, 1.0);

        // Then
        assertEquals(3, original.maxAttempts());
        assertEquals(5, changed.maxAttempts());
        assertFalse(changed.jitter());
        assertEquals(original.maxDelaySeconds(), changed.maxDelaySeconds());
    }
}
