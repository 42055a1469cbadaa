package com.ryuqq.resilience.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * {@link Properties} 기반 {@link ResilienceSettings} 구현.
 *
 * <p><strong>키 형식:</strong></p>
 * <pre>
 * resilience.operations.&lt;operation&gt;.strategy=conservative
 * </pre>
 *
 * <p>알 수 없는 전략 값은 경고 로그를 남기고 무시합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PropertiesResilienceSettings implements ResilienceSettings {

    public static final String DEFAULT_RESOURCE = "resilience.properties";

    private static final Logger log = LoggerFactory.getLogger(PropertiesResilienceSettings.class);
    private static final String PREFIX = "resilience.operations.";
    private static final String SUFFIX = ".strategy";

    private final Map<String, ResilienceStrategy> strategies;

    /**
     * 생성자.
     *
     * @param properties 설정 원본
     * @throws IllegalArgumentException properties가 null인 경우
     */
    public PropertiesResilienceSettings(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        this.strategies = Collections.unmodifiableMap(parse(properties));
    }

    /**
     * 클래스패스의 {@value #DEFAULT_RESOURCE} 로드.
     *
     * <p>리소스가 없으면 빈 설정을 반환합니다.</p>
     *
     * @return PropertiesResilienceSettings
     */
    public static PropertiesResilienceSettings fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * 클래스패스 리소스 로드.
     *
     * @param resource 리소스 경로
     * @return PropertiesResilienceSettings
     * @throws UncheckedIOException 리소스 읽기 실패 시
     */
    public static PropertiesResilienceSettings fromClasspath(String resource) {
        Properties properties = new Properties();
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = PropertiesResilienceSettings.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("Resilience settings resource not found: {}", resource);
            } else {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load resilience settings: " + resource, e);
        }
        return new PropertiesResilienceSettings(properties);
    }

    @Override
    public Optional<ResilienceStrategy> operationStrategy(String operationName) {
        return Optional.ofNullable(strategies.get(operationName));
    }

    /**
     * 설정된 operation 수.
     *
     * @return operation 수
     */
    public int size() {
        return strategies.size();
    }

    private static Map<String, ResilienceStrategy> parse(Properties properties) {
        Map<String, ResilienceStrategy> parsed = new HashMap<>();
        for (String key : properties.stringPropertyNames()) {
            if (!key.startsWith(PREFIX) || !key.endsWith(SUFFIX)) {
                continue;
            }
            String operationName = key.substring(PREFIX.length(), key.length() - SUFFIX.length());
            if (operationName.isBlank()) {
                continue;
            }
            String value = properties.getProperty(key);
            try {
                parsed.put(operationName, ResilienceStrategy.fromValue(value));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring invalid strategy '{}' for operation '{}'", value, operationName);
            }
        }
        return parsed;
    }
}
