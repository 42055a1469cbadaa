package com.ryuqq.resilience.core.config;

import java.util.Locale;

/**
 * 이름 있는 Resilience 전략 preset.
 *
 * <p>각 전략은 {@link ResiliencePresets}에 정의된 표준 {@link ResilienceConfig}로 매핑됩니다.</p>
 *
 * <ul>
 *   <li>AGGRESSIVE: 짧은 대기, 낮은 실패 허용치 (사용자 대면 작업)</li>
 *   <li>BALANCED: 대부분의 작업에 적합한 기본 전략</li>
 *   <li>CONSERVATIVE: 긴 대기, 높은 실패 허용치</li>
 *   <li>CRITICAL: 미션 크리티컬 작업을 위한 최대 재시도</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ResilienceStrategy {

    AGGRESSIVE("aggressive"),
    BALANCED("balanced"),
    CONSERVATIVE("conservative"),
    CRITICAL("critical");

    private final String value;

    ResilienceStrategy(String value) {
        this.value = value;
    }

    /**
     * 외부 설정에서 사용하는 소문자 값.
     *
     * @return 전략 값 (예: "balanced")
     */
    public String value() {
        return value;
    }

    /**
     * 문자열 값으로 전략 조회 (대소문자 무시).
     *
     * @param value 전략 값
     * @return ResilienceStrategy
     * @throws IllegalArgumentException null, 빈 문자열 또는 알 수 없는 값인 경우
     */
    public static ResilienceStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("strategy value cannot be null or blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ResilienceStrategy strategy : values()) {
            if (strategy.value.equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown resilience strategy: " + value);
    }
}
