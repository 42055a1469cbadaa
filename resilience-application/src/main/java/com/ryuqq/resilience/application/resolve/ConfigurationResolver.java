package com.ryuqq.resilience.application.resolve;

import com.ryuqq.resilience.core.config.ResilienceConfig;
import com.ryuqq.resilience.core.config.ResiliencePresets;
import com.ryuqq.resilience.core.config.ResilienceSettings;
import com.ryuqq.resilience.core.config.ResilienceStrategy;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 호출 단위 {@link ResilienceConfig} 결정기.
 *
 * <p><strong>우선순위 (먼저 일치하는 항목 사용):</strong></p>
 * <ol>
 *   <li>customConfig: 그대로 사용, strategy 인자는 무시</li>
 *   <li>strategy: 해당 전략의 표준 설정, 등록된 전략보다 우선</li>
 *   <li>{@link #register(String, ResilienceStrategy)}로 등록된 전략</li>
 *   <li>{@link ResilienceSettings}에 설정된 전략</li>
 *   <li>BALANCED</li>
 * </ol>
 *
 * <p>resolve는 실패하지 않으며 부수 효과가 없습니다. 등록 테이블은 ConcurrentHashMap이므로
 * 등록과 resolve를 동시에 호출해도 안전합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConfigurationResolver {

    public static final ResilienceStrategy DEFAULT_STRATEGY = ResilienceStrategy.BALANCED;

    private final ConcurrentHashMap<String, ResilienceStrategy> registered = new ConcurrentHashMap<>();
    private final ResilienceSettings settings;

    /**
     * 외부 설정 없이 생성.
     */
    public ConfigurationResolver() {
        this(ResilienceSettings.NONE);
    }

    /**
     * 생성자.
     *
     * @param settings 외부 설정
     * @throws IllegalArgumentException settings가 null인 경우
     */
    public ConfigurationResolver(ResilienceSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        this.settings = settings;
    }

    /**
     * operation 전략 등록 (덮어쓰기).
     *
     * @param operationName operation 이름
     * @param strategy 전략
     * @throws IllegalArgumentException 인자가 null이거나 operationName이 빈 문자열인 경우
     */
    public void register(String operationName, ResilienceStrategy strategy) {
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName cannot be null or blank");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        registered.put(operationName, strategy);
    }

    /**
     * 등록된 전략 조회.
     *
     * @param operationName operation 이름
     * @return 등록된 전략, 없으면 empty
     */
    public Optional<ResilienceStrategy> registeredStrategy(String operationName) {
        if (operationName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(registered.get(operationName));
    }

    /**
     * 전체 등록 조회.
     *
     * @return operation 이름 → 전략 (복사본, 이름 순 정렬)
     */
    public Map<String, ResilienceStrategy> registeredOperations() {
        return new TreeMap<>(registered);
    }

    /**
     * 호출에 적용할 설정 결정.
     *
     * @param operationName operation 이름
     * @param strategy 호출 시 지정한 전략 (nullable)
     * @param customConfig 호출 시 지정한 설정 (nullable)
     * @return 최종 설정 (non-null)
     */
    public ResilienceConfig resolve(String operationName, ResilienceStrategy strategy, ResilienceConfig customConfig) {
        if (customConfig != null) {
            return customConfig;
        }
        if (strategy != null) {
            return ResiliencePresets.forStrategy(strategy);
        }
        return ResiliencePresets.forStrategy(resolveStrategy(operationName));
    }

    private ResilienceStrategy resolveStrategy(String operationName) {
        ResilienceStrategy registeredStrategy = registered.get(operationName);
        if (registeredStrategy != null) {
            return registeredStrategy;
        }
        return settings.operationStrategy(operationName).orElse(DEFAULT_STRATEGY);
    }
}
