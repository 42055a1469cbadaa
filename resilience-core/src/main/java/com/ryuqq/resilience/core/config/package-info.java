/**
 * Resilience configuration package.
 *
 * <p>Immutable, validated configuration records and the four named strategies.</p>
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.resilience.core.config.RetryConfig} - attempts, delay budget, backoff and jitter</li>
 *   <li>{@link com.ryuqq.resilience.core.config.CircuitBreakerConfig} - failure threshold and recovery timeout</li>
 *   <li>{@link com.ryuqq.resilience.core.config.ResilienceConfig} - strategy plus both configs and enable flags</li>
 *   <li>{@link com.ryuqq.resilience.core.config.ResiliencePresets} - built-in config per strategy</li>
 *   <li>{@link com.ryuqq.resilience.core.config.ResilienceSettings} - external operation → strategy source</li>
 * </ul>
 *
 * <h2>Validation</h2>
 * <p>Out-of-range values fail at construction with {@link java.lang.IllegalArgumentException}
 * naming the field and the rejected value.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.resilience.core.config;
