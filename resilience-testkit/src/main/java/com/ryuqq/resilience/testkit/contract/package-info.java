/**
 * Contract test base for resilience orchestrator behavior.
 *
 * <p>Extend {@link com.ryuqq.resilience.testkit.contract.AbstractContractTest} to verify
 * retry, circuit breaker, metrics, fallback and health behavior against a deterministic clock.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.testkit.contract;
