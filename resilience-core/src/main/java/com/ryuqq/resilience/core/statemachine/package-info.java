/**
 * Circuit breaker state machine.
 *
 * <p>{@link com.ryuqq.resilience.core.statemachine.CircuitBreakerTransition} rejects every
 * transition outside CLOSED → OPEN → HALF_OPEN → CLOSED | OPEN.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.resilience.core.statemachine;
