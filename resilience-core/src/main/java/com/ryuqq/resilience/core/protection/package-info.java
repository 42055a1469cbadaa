/**
 * Circuit breaker contract and state.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.resilience.core.protection;
