package com.ryuqq.resilience.application.resolve;

import com.ryuqq.resilience.core.config.CircuitBreakerConfig;
import com.ryuqq.resilience.core.config.ResilienceConfig;
import com.ryuqq.resilience.core.config.ResiliencePresets;
import com.ryuqq.resilience.core.config.ResilienceSettings;
import com.ryuqq.resilience.core.config.ResilienceStrategy;
import com.ryuqq.resilience.core.config.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ConfigurationResolver 우선순위 테스트.
 *
 * <p>custom &gt; strategy &gt; 등록 &gt; 외부 설정 &gt; BALANCED</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ConfigurationResolverTest {

    @Mock
    private ResilienceSettings settings;

    private ConfigurationResolver resolver;

    private final ResilienceConfig custom = ResilienceConfig.of(
        ResilienceStrategy.CRITICAL,
        new RetryConfig().withMaxAttempts(9),
        new CircuitBreakerConfig(2, 10)
    );

    @BeforeEach
    void setUp() {
        resolver = new ConfigurationResolver(settings);
    }

    // ============================================================
    // 1. 기본값
    // ============================================================

    @Test
    @DisplayName("등록도 지정도 없으면 BALANCED로 결정된다")
    void 아무것도_없으면_BALANCED() {
        // given
        when(settings.operationStrategy("unknown")).thenReturn(Optional.empty());

        // when
        ResilienceConfig config = resolver.resolve("unknown", null, null);

        // then
        assertThat(config).isEqualTo(ResiliencePresets.forStrategy(ResilienceStrategy.BALANCED));
        assertThat(config.strategy()).isEqualTo(ResilienceStrategy.BALANCED);
    }

    // ============================================================
    // 2. 우선순위
    // ============================================================

    @Test
    @DisplayName("customConfig는 strategy보다 우선한다")
    void custom이_strategy보다_우선() {
        // given
        resolver.register("op", ResilienceStrategy.CONSERVATIVE);

        // when
        ResilienceConfig config = resolver.resolve("op", ResilienceStrategy.AGGRESSIVE, custom);

        // then
        assertThat(config).isSameAs(custom);
        verify(settings, never()).operationStrategy(anyString());
    }

    @Test
    @DisplayName("strategy는 등록된 전략보다 우선한다")
    void strategy가_등록보다_우선() {
        // given
        resolver.register("op", ResilienceStrategy.CONSERVATIVE);

        // when
        ResilienceConfig config = resolver.resolve("op", ResilienceStrategy.AGGRESSIVE, null);

        // then
        assertThat(config.strategy()).isEqualTo(ResilienceStrategy.AGGRESSIVE);
    }

    @Test
    @DisplayName("등록된 전략은 외부 설정보다 우선한다")
    void 등록이_외부설정보다_우선() {
        // given
        resolver.register("payments", ResilienceStrategy.CONSERVATIVE);

        // when
        ResilienceConfig config = resolver.resolve("payments", null, null);

        // then
        assertThat(config.strategy()).isEqualTo(ResilienceStrategy.CONSERVATIVE);
        assertThat(config.retryConfig().maxAttempts()).isEqualTo(5);
        verify(settings, never()).operationStrategy("payments");
    }

    @Test
    @DisplayName("등록이 없으면 외부 설정의 전략을 사용한다")
    void 외부설정_사용() {
        // given
        when(settings.operationStrategy("ai_scan")).thenReturn(Optional.of(ResilienceStrategy.CRITICAL));

        // when
        ResilienceConfig config = resolver.resolve("ai_scan", null, null);

        // then
        assertThat(config.strategy()).isEqualTo(ResilienceStrategy.CRITICAL);
    }

    // ============================================================
    // 3. 등록
    // ============================================================

    @Test
    @DisplayName("같은 이름으로 다시 등록하면 덮어쓴다")
    void 재등록은_덮어쓰기() {
        resolver.register("op", ResilienceStrategy.AGGRESSIVE);
        resolver.register("op", ResilienceStrategy.CRITICAL);

        assertThat(resolver.registeredStrategy("op")).contains(ResilienceStrategy.CRITICAL);
        assertThat(resolver.registeredOperations()).hasSize(1);
    }

    @Test
    @DisplayName("잘못된 등록 인자는 거부된다")
    void 등록_검증() {
        assertThatThrownBy(() -> resolver.register(" ", ResilienceStrategy.BALANCED))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.register("op", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConfigurationResolver(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("기본 생성자는 외부 설정 없이 동작한다")
    void 기본_생성자() {
        ConfigurationResolver plain = new ConfigurationResolver();

        assertThat(plain.resolve("anything", null, null).strategy()).isEqualTo(ResilienceStrategy.BALANCED);
        assertThat(plain.registeredStrategy(null)).isEmpty();
    }
}
