/**
 * Runner Adapter Layer - ResilienceOrchestrator 구현체.
 *
 * <p>이 패키지는 ResilienceOrchestrator 인터페이스의 구체적인 구현체와 실행 엔진을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.resilience.adapter.runner.DefaultResilienceOrchestrator} - 정책 조합, 조회/초기화 API</li>
 *   <li>{@link com.ryuqq.resilience.adapter.runner.RetryExecutor} - 동기/비동기 재시도 엔진</li>
 *   <li>{@link com.ryuqq.resilience.adapter.runner.BackoffCalculator} - Exponential Backoff with Jitter</li>
 *   <li>{@link com.ryuqq.resilience.adapter.runner.FallbackExecutor} - 최종 실패 시 fallback 실행</li>
 *   <li>{@link com.ryuqq.resilience.adapter.runner.HealthAggregator} - Circuit Breaker 상태 집계</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DefaultResilienceOrchestrator)
 *   ↓ implements
 * application (ResilienceOrchestrator, ResilienceDecorator)
 *   ↓ depends on
 * core (config, classification, metrics, protection)
 *   ↑ implements
 * adapter-inmemory (CountingCircuitBreaker, registries)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.runner;
