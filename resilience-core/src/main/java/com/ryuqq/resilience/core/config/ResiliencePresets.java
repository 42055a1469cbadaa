package com.ryuqq.resilience.core.config;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 전략별 표준 {@link ResilienceConfig}.
 *
 * <pre>
 * 전략          | 시도 | 총시간 | 배수 | min  | max  | jitterMax | 임계값 | 복구
 * AGGRESSIVE    |  2   |  10s   | 0.5  | 1.0  |  5.0 |   2.0     |   3    |  30s
 * BALANCED      |  3   |  30s   | 1.0  | 2.0  | 10.0 |   2.0     |   5    |  60s
 * CONSERVATIVE  |  5   | 120s   | 2.0  | 4.0  | 30.0 |   2.0     |   8    | 120s
 * CRITICAL      |  7   | 300s   | 1.5  | 3.0  | 60.0 |   5.0     |  10    | 300s
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResiliencePresets {

    private static final Map<ResilienceStrategy, ResilienceConfig> DEFAULTS;

    static {
        Map<ResilienceStrategy, ResilienceConfig> presets = new EnumMap<>(ResilienceStrategy.class);
        presets.put(ResilienceStrategy.AGGRESSIVE, ResilienceConfig.of(
            ResilienceStrategy.AGGRESSIVE,
            new RetryConfig(2, 10, 0.5, 1.0, 5.0, true, 2.0),
            new CircuitBreakerConfig(3, 30)
        ));
        presets.put(ResilienceStrategy.BALANCED, ResilienceConfig.of(
            ResilienceStrategy.BALANCED,
            new RetryConfig(3, 30, 1.0, 2.0, 10.0, true, 2.0),
            new CircuitBreakerConfig(5, 60)
        ));
        presets.put(ResilienceStrategy.CONSERVATIVE, ResilienceConfig.of(
            ResilienceStrategy.CONSERVATIVE,
            new RetryConfig(5, 120, 2.0, 4.0, 30.0, true, 2.0),
            new CircuitBreakerConfig(8, 120)
        ));
        presets.put(ResilienceStrategy.CRITICAL, ResilienceConfig.of(
            ResilienceStrategy.CRITICAL,
            new RetryConfig(7, 300, 1.5, 3.0, 60.0, true, 5.0),
            new CircuitBreakerConfig(10, 300)
        ));
        DEFAULTS = Collections.unmodifiableMap(presets);
    }

    // Utility class - prevent instantiation
    private ResiliencePresets() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전략의 표준 설정 조회.
     *
     * @param strategy 전략
     * @return 표준 ResilienceConfig
     * @throws IllegalArgumentException strategy가 null인 경우
     */
    public static ResilienceConfig forStrategy(ResilienceStrategy strategy) {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        return DEFAULTS.get(strategy);
    }

    /**
     * 전체 preset 조회 (읽기 전용).
     *
     * @return 전략 → 설정 맵
     */
    public static Map<ResilienceStrategy, ResilienceConfig> defaults() {
        return DEFAULTS;
    }
}
