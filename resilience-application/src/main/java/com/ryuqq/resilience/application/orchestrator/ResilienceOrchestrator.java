package com.ryuqq.resilience.application.orchestrator;

import com.ryuqq.resilience.application.view.HealthStatus;
import com.ryuqq.resilience.application.view.MetricsReport;
import com.ryuqq.resilience.core.config.ResilienceConfig;
import com.ryuqq.resilience.core.config.ResilienceStrategy;
import com.ryuqq.resilience.core.metrics.ResilienceMetrics;

/**
 * Resilience 정책 조정자.
 *
 * <p>operation 이름 단위로 재시도, Circuit Breaker, metrics, fallback을 조합합니다.
 * 구현체는 자신의 metrics 저장소와 Circuit Breaker 테이블을 소유하므로
 * 여러 인스턴스를 만들어도 서로 상태를 공유하지 않습니다.</p>
 *
 * <p><strong>호출 1회의 실행 순서:</strong></p>
 * <ol>
 *   <li>설정 결정 (custom &gt; strategy &gt; 등록된 operation &gt; 외부 설정 &gt; BALANCED)</li>
 *   <li>Circuit Breaker 활성 시 상태 확인, OPEN이면 operation 실행 없이 거부</li>
 *   <li>재시도 엔진을 통해 operation 실행</li>
 *   <li>성공: operation metrics와 breaker metrics에 성공 기록</li>
 *   <li>최종 실패: 양쪽에 실패 기록 후 fallback 시도</li>
 *   <li>결과 반환 또는 예외 전파</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResilienceOrchestrator {

    /**
     * operation을 BALANCED 전략으로 등록.
     *
     * @param operationName operation 이름
     * @throws IllegalArgumentException operationName이 null이거나 빈 문자열인 경우
     */
    void registerOperation(String operationName);

    /**
     * operation 전략 등록. 같은 이름으로 다시 등록하면 덮어씁니다.
     *
     * @param operationName operation 이름
     * @param strategy 전략
     * @throws IllegalArgumentException 인자가 null이거나 operationName이 빈 문자열인 경우
     */
    void registerOperation(String operationName, ResilienceStrategy strategy);

    /**
     * 등록된 전략 또는 기본 전략으로 decorator 생성.
     *
     * @param operationName operation 이름
     * @return ResilienceDecorator
     * @throws IllegalArgumentException operationName이 null이거나 빈 문자열인 경우
     */
    ResilienceDecorator withResilience(String operationName);

    /**
     * 전략을 지정하여 decorator 생성. 등록된 전략보다 우선합니다.
     *
     * @param operationName operation 이름
     * @param strategy 전략 (null이면 등록/기본 전략 사용)
     * @return ResilienceDecorator
     */
    ResilienceDecorator withResilience(String operationName, ResilienceStrategy strategy);

    /**
     * 사용자 설정으로 decorator 생성. customConfig가 있으면 strategy는 무시됩니다.
     *
     * @param operationName operation 이름
     * @param strategy 전략 (nullable)
     * @param customConfig 사용자 설정 (nullable)
     * @return ResilienceDecorator
     */
    ResilienceDecorator withResilience(String operationName, ResilienceStrategy strategy, ResilienceConfig customConfig);

    /**
     * operation 등록/설정 기반 decorator. {@link #withResilience(String)}와 같습니다.
     *
     * @param operationName operation 이름
     * @return ResilienceDecorator
     */
    default ResilienceDecorator withOperationResilience(String operationName) {
        return withResilience(operationName);
    }

    /**
     * AGGRESSIVE 전략 decorator.
     *
     * @param operationName operation 이름
     * @return ResilienceDecorator
     */
    default ResilienceDecorator withAggressiveResilience(String operationName) {
        return withResilience(operationName, ResilienceStrategy.AGGRESSIVE);
    }

    /**
     * BALANCED 전략 decorator.
     *
     * @param operationName operation 이름
     * @return ResilienceDecorator
     */
    default ResilienceDecorator withBalancedResilience(String operationName) {
        return withResilience(operationName, ResilienceStrategy.BALANCED);
    }

    /**
     * CONSERVATIVE 전략 decorator.
     *
     * @param operationName operation 이름
     * @return ResilienceDecorator
     */
    default ResilienceDecorator withConservativeResilience(String operationName) {
        return withResilience(operationName, ResilienceStrategy.CONSERVATIVE);
    }

    /**
     * CRITICAL 전략 decorator.
     *
     * @param operationName operation 이름
     * @return ResilienceDecorator
     */
    default ResilienceDecorator withCriticalResilience(String operationName) {
        return withResilience(operationName, ResilienceStrategy.CRITICAL);
    }

    /**
     * operation metrics 조회, 없으면 생성.
     *
     * <p>같은 이름이면 항상 같은 인스턴스를 반환합니다.</p>
     *
     * @param operationName operation 이름
     * @return ResilienceMetrics
     */
    ResilienceMetrics getMetrics(String operationName);

    /**
     * 전체 operation과 Circuit Breaker의 metrics 보고서.
     *
     * @return MetricsReport
     */
    MetricsReport getAllMetrics();

    /**
     * 모든 operation과 Circuit Breaker의 counter 초기화. Circuit Breaker 상태는 유지됩니다.
     */
    void resetMetrics();

    /**
     * 특정 operation과 해당 Circuit Breaker의 counter 초기화. Circuit Breaker 상태는 유지됩니다.
     *
     * @param operationName operation 이름
     */
    void resetMetrics(String operationName);

    /**
     * OPEN 상태의 Circuit Breaker가 하나도 없으면 true.
     *
     * @return 건강 여부
     */
    boolean isHealthy();

    /**
     * Circuit Breaker 상태 요약.
     *
     * @return HealthStatus
     */
    HealthStatus getHealthStatus();
}
