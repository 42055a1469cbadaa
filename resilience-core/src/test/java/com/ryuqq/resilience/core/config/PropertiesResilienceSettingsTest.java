package com.ryuqq.resilience.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PropertiesResilienceSettings 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("PropertiesResilienceSettings 테스트")
class PropertiesResilienceSettingsTest {

    @Test
    void operation별_전략_키를_읽는다() {
        // given
        Properties properties = new Properties();
        properties.setProperty("resilience.operations.payments.strategy", "conservative");
        properties.setProperty("resilience.operations.search.strategy", "AGGRESSIVE");
        properties.setProperty("unrelated.key", "critical");

        // when
        PropertiesResilienceSettings settings = new PropertiesResilienceSettings(properties);

        // then
        assertEquals(Optional.of(ResilienceStrategy.CONSERVATIVE), settings.operationStrategy("payments"));
        assertEquals(Optional.of(ResilienceStrategy.AGGRESSIVE), settings.operationStrategy("search"));
        assertEquals(Optional.empty(), settings.operationStrategy("unknown"));
        assertEquals(2, settings.size());
    }

    @Test
    void 잘못된_전략_값과_빈_이름은_무시한다() {
        // given
        Properties properties = new Properties();
        properties.setProperty("resilience.operations.broken.strategy", "reckless");
        properties.setProperty("resilience.operations..strategy", "balanced");

        // when
        PropertiesResilienceSettings settings = new PropertiesResilienceSettings(properties);

        // then
        assertEquals(0, settings.size());
        assertTrue(settings.operationStrategy("broken").isEmpty());
    }

    @Test
    void classpath_리소스에서_읽는다() {
        // when
        PropertiesResilienceSettings settings = PropertiesResilienceSettings.fromClasspath("resilience-settings-test.properties");

        // then
        assertEquals(Optional.of(ResilienceStrategy.CRITICAL), settings.operationStrategy("ledger"));
        assertEquals(Optional.of(ResilienceStrategy.BALANCED), settings.operationStrategy("catalog"));
        assertEquals(2, settings.size());
    }

    @Test
    void 리소스가_없으면_빈_설정() {
        // when
        PropertiesResilienceSettings settings = PropertiesResilienceSettings.fromClasspath("missing.properties");

        // then
        assertEquals(0, settings.size());
    }

    @Test
    void NONE은_항상_비어_있다() {
        // when & then
        assertTrue(ResilienceSettings.NONE.operationStrategy("anything").isEmpty());
    }

    @Test
    void null_properties는_예외() {
        // when & then
        assertThrows(IllegalArgumentException.class, () -> new PropertiesResilienceSettings(null));
    }
}
