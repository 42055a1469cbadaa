package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.metrics.ResilienceMetrics;

import java.util.Optional;

/**
 * Circuit Breaker SPI.
 *
 * <p>operation 이름 하나당 하나의 인스턴스가 존재하며, 연속 실패가 임계값에 도달하면
 * 빠르게 실패(Fail-Fast)하여 장애가 전파되는 것을 방지합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = registry.getOrCreate("ai_summarize", config);
 *
 * CircuitBreakerPermit permit = cb.tryAcquire()
 *     .orElseThrow(() -> new ServiceUnavailableException("ai_summarize", cb.getState()));
 *
 * try {
 *     Result result = externalApi.call();
 *     cb.recordSuccess(permit);
 *     return result;
 * } catch (Exception e) {
 *     cb.recordFailure(permit, e);
 *     throw e;
 * }
 * }</pre>
 *
 * <p>구현체는 thread-safe해야 하며, 상태 전이는 {@link com.ryuqq.resilience.core.statemachine.CircuitBreakerTransition}
 * 규칙을 따라야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * operation 이름.
     *
     * @return operation 이름
     */
    String getName();

    /**
     * Circuit Breaker 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 허가 발급</li>
     *   <li>OPEN: recoveryTimeout 경과 전이면 empty, 경과했으면 HALF_OPEN 전이 후 시험 호출 허가 발급</li>
     *   <li>HALF_OPEN: 진행 중인 시험 호출이 없을 때만 시험 호출 허가 발급</li>
     * </ul>
     *
     * <p>허가를 받은 호출자는 반드시 같은 허가로 {@link #recordSuccess(CircuitBreakerPermit)} 또는
     * {@link #recordFailure(CircuitBreakerPermit, Throwable)} 중 하나를 호출해야 합니다.
     * HALF_OPEN 시험 호출의 결과가 보고되지 않으면 HALF_OPEN 상태가 유지됩니다.</p>
     *
     * @return 통과 허가, 차단되면 empty
     */
    Optional<CircuitBreakerPermit> tryAcquire();

    /**
     * 실행 성공 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 카운터 초기화</li>
     *   <li>HALF_OPEN: 시험 호출 허가인 경우에만 CLOSED로 전이</li>
     * </ul>
     *
     * <p>현재 세대가 아닌 허가의 결과는 metrics에만 반영되고 상태를 바꾸지 않습니다.</p>
     *
     * @param permit {@link #tryAcquire()}가 발급한 허가
     */
    void recordSuccess(CircuitBreakerPermit permit);

    /**
     * 실행 실패 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 카운터 증가, 임계값 도달 시 OPEN으로 전이</li>
     *   <li>HALF_OPEN: 시험 호출 허가인 경우에만 즉시 OPEN으로 전이 (복구 타이머 재시작)</li>
     * </ul>
     *
     * <p>현재 세대가 아닌 허가의 결과는 metrics에만 반영되고 상태를 바꾸지 않습니다.</p>
     *
     * @param permit {@link #tryAcquire()}가 발급한 허가
     * @param throwable 발생한 예외
     */
    void recordFailure(CircuitBreakerPermit permit, Throwable throwable);

    /**
     * 현재 Circuit Breaker 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * Circuit Breaker 자체 metrics.
     *
     * <p>operation 단위 metrics와 독립적으로 유지됩니다.</p>
     *
     * @return ResilienceMetrics
     */
    ResilienceMetrics getMetrics();

    /**
     * 상태, 설정, metrics의 일관된 스냅샷.
     *
     * @return CircuitBreakerSnapshot
     */
    CircuitBreakerSnapshot snapshot();

    /**
     * Circuit Breaker를 CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다. metrics는 유지됩니다.</p>
     */
    void reset();
}
