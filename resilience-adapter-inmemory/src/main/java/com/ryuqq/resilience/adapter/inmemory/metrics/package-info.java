/**
 * In-memory metrics registry.
 *
 * @see com.ryuqq.resilience.core.spi.MetricsRegistry
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.metrics;
