/**
 * In-memory circuit breaker adapter package.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.resilience.adapter.inmemory.breaker.CountingCircuitBreaker}:
 *       consecutive-failure state machine with a single HALF_OPEN trial call</li>
 *   <li>{@link com.ryuqq.resilience.adapter.inmemory.breaker.InMemoryCircuitBreakerRegistry}:
 *       lazily created breaker table keyed by operation name</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>State is lost on process restart</li>
 *   <li>Breakers are not shared between processes</li>
 * </ul>
 *
 * @see com.ryuqq.resilience.core.spi.CircuitBreakerRegistry
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.breaker;
