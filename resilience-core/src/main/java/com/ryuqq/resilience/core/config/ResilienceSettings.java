package com.ryuqq.resilience.core.config;

import java.util.Optional;

/**
 * 외부 설정 SPI.
 *
 * <p>애플리케이션 설정에서 operation별 전략을 제공합니다.
 * Configuration Resolver는 등록된 operation이 없을 때 이 설정을 참조하고,
 * 여기에도 없으면 BALANCED로 결정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResilienceSettings {

    /**
     * 설정이 없는 구현.
     */
    ResilienceSettings NONE = operationName -> Optional.empty();

    /**
     * operation에 설정된 전략 조회.
     *
     * @param operationName operation 이름
     * @return 설정된 전략, 없으면 empty
     */
    Optional<ResilienceStrategy> operationStrategy(String operationName);
}
