package com.ryuqq.resilience.core.spi;

import com.ryuqq.resilience.core.config.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreaker;

import java.util.Map;
import java.util.Optional;

/**
 * operation 단위 Circuit Breaker 테이블 SPI.
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>operation 이름당 하나의 Circuit Breaker를 지연 생성</li>
 *   <li>최초 생성 시의 설정이 유지됨 (이후 호출의 config는 무시)</li>
 *   <li>Thread-safe, 서로 다른 이름 간 전역 lock 금지</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CircuitBreakerRegistry {

    /**
     * Circuit Breaker 조회, 없으면 생성.
     *
     * @param operationName operation 이름
     * @param config 생성 시 사용할 설정
     * @return CircuitBreaker (같은 이름이면 같은 인스턴스)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    CircuitBreaker getOrCreate(String operationName, CircuitBreakerConfig config);

    /**
     * Circuit Breaker 조회 (생성하지 않음).
     *
     * @param operationName operation 이름
     * @return CircuitBreaker, 없으면 empty
     */
    Optional<CircuitBreaker> find(String operationName);

    /**
     * 전체 Circuit Breaker 조회.
     *
     * @return operation 이름 → CircuitBreaker (복사본, 이름 순 정렬)
     */
    Map<String, CircuitBreaker> all();

    /**
     * 등록된 Circuit Breaker 수.
     *
     * @return Circuit Breaker 수
     */
    int size();
}
