/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Storage seams that adapters implement for the orchestrator.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.resilience.core.spi.MetricsRegistry} - operation name → metrics (get-or-create, reset in place)</li>
 *   <li>{@link com.ryuqq.resilience.core.spi.CircuitBreakerRegistry} - operation name → circuit breaker (created once, first config wins)</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>resilience-adapter-inmemory provides process-local implementations.
 * Implementations must be thread-safe and must never create two instances for one name.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.resilience.core.spi;
