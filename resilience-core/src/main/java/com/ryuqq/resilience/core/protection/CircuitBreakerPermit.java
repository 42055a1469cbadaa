package com.ryuqq.resilience.core.protection;

/**
 * {@link CircuitBreaker#tryAcquire()}가 발급하는 통과 허가.
 *
 * <p>호출 결과는 이 허가와 함께 보고되어야 합니다. breaker는 허가가 발급된 세대(generation)와
 * 시험 호출 여부로 결과가 현재 상태에 영향을 줄 수 있는지 판단합니다.</p>
 *
 * <ul>
 *   <li>generation: 허가 발급 시점의 상태 세대. 상태 전이 또는 reset마다 증가</li>
 *   <li>trial: HALF_OPEN에서 복구 여부를 확인하는 단일 시험 호출이면 true</li>
 * </ul>
 *
 * @param generation 발급 시점의 상태 세대
 * @param trial HALF_OPEN 시험 호출 여부
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CircuitBreakerPermit(long generation, boolean trial) {

    /**
     * 상태를 추적하지 않는 breaker용 허가.
     */
    public static final CircuitBreakerPermit UNTRACKED = new CircuitBreakerPermit(0L, false);
}
