package com.ryuqq.resilience.core.statemachine;

import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.Test;

import static com.ryuqq.resilience.core.protection.CircuitBreakerState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * CircuitBreakerTransition 테스트.
 *
 * <ul>
 *   <li>CLOSED → OPEN, OPEN → HALF_OPEN, HALF_OPEN → CLOSED/OPEN 만 허용</li>
 *   <li>그 외 전이는 IllegalStateException</li>
 *   <li>reset은 모든 상태에서 CLOSED</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CircuitBreakerTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_ClosedToOpen_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> CircuitBreakerTransition.validate(CLOSED, OPEN));
    }

    @Test
    void validate_OpenToHalfOpen_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> CircuitBreakerTransition.validate(OPEN, HALF_OPEN));
    }

    @Test
    void validate_HalfOpenToClosedOrOpen_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> CircuitBreakerTransition.validate(HALF_OPEN, CLOSED));
        assertDoesNotThrow(() -> CircuitBreakerTransition.validate(HALF_OPEN, OPEN));
    }

    @Test
    void transition_FullRecoveryCycle_Succeeds() {
        // Given
        CircuitBreakerState state = CLOSED;

        // When
        state = CircuitBreakerTransition.transition(state, OPEN);
        state = CircuitBreakerTransition.transition(state, HALF_OPEN);
        state = CircuitBreakerTransition.transition(state, CLOSED);

        // Then
        assertEquals(CLOSED, state);
    }

    // ========== 잘못된 전이 테스트 ==========

    @Test
    void validate_ClosedToHalfOpen_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> CircuitBreakerTransition.validate(CLOSED, HALF_OPEN)
        );
        assertTrue(exception.getMessage().contains("CLOSED → HALF_OPEN"));
    }

    @Test
    void validate_OpenToClosed_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, () -> CircuitBreakerTransition.validate(OPEN, CLOSED));
    }

    @Test
    void validate_SameState_ThrowsException() {
        // When & Then
        for (CircuitBreakerState state : CircuitBreakerState.values()) {
            assertThrows(IllegalStateException.class, () -> CircuitBreakerTransition.validate(state, state));
        }
    }

    @Test
    void validate_NullState_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> CircuitBreakerTransition.validate(null, OPEN));
        assertThrows(IllegalArgumentException.class, () -> CircuitBreakerTransition.validate(CLOSED, null));
    }

    // ========== reset ==========

    @Test
    void reset_AnyState_ReturnsClosed() {
        // When & Then
        for (CircuitBreakerState state : CircuitBreakerState.values()) {
            assertEquals(CLOSED, CircuitBreakerTransition.reset(state));
        }
    }

    @Test
    void value_ReturnsLowercaseName() {
        // When & Then
        assertEquals("closed", CLOSED.value());
        assertEquals("open", OPEN.value());
        assertEquals("half_open", HALF_OPEN.value());
    }
}
