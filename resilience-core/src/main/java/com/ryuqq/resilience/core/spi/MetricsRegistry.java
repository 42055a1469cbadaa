package com.ryuqq.resilience.core.spi;

import com.ryuqq.resilience.core.metrics.ResilienceMetrics;

import java.util.Map;
import java.util.Optional;

/**
 * operation 단위 metrics 저장소 SPI.
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>Thread-safe: 모든 메서드는 여러 스레드에서 동시에 호출 가능해야 함</li>
 *   <li>서로 다른 operation 이름 간 전역 lock 금지</li>
 *   <li>같은 이름에 대해서는 항상 같은 인스턴스 반환 (누적을 위해 참조 동일성 필요)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MetricsRegistry {

    /**
     * metrics 조회, 없으면 생성.
     *
     * @param operationName operation 이름
     * @return ResilienceMetrics (같은 이름이면 같은 인스턴스)
     * @throws IllegalArgumentException operationName이 null이거나 빈 문자열인 경우
     */
    ResilienceMetrics getMetrics(String operationName);

    /**
     * metrics 조회 (생성하지 않음).
     *
     * @param operationName operation 이름
     * @return ResilienceMetrics, 없으면 empty
     */
    Optional<ResilienceMetrics> find(String operationName);

    /**
     * 전체 metrics 조회.
     *
     * @return operation 이름 → metrics (복사본, 이름 순 정렬)
     */
    Map<String, ResilienceMetrics> all();

    /**
     * 특정 operation의 counter 초기화. 없는 이름이면 아무 동작 안 함.
     *
     * @param operationName operation 이름
     */
    void reset(String operationName);

    /**
     * 모든 operation의 counter 초기화.
     */
    void resetAll();

    /**
     * 등록된 operation 수.
     *
     * @return operation 수
     */
    int size();
}
