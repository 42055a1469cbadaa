package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.adapter.inmemory.breaker.InMemoryCircuitBreakerRegistry;
import com.ryuqq.resilience.adapter.inmemory.metrics.InMemoryMetricsRegistry;
import com.ryuqq.resilience.application.orchestrator.ResilienceDecorator;
import com.ryuqq.resilience.application.orchestrator.ResilienceOrchestrator;
import com.ryuqq.resilience.application.resolve.ConfigurationResolver;
import com.ryuqq.resilience.application.view.CircuitBreakerView;
import com.ryuqq.resilience.application.view.HealthStatus;
import com.ryuqq.resilience.application.view.MetricsReport;
import com.ryuqq.resilience.application.view.MetricsSummary;
import com.ryuqq.resilience.application.view.MetricsView;
import com.ryuqq.resilience.core.classification.DefaultExceptionClassifier;
import com.ryuqq.resilience.core.classification.ExceptionClassifier;
import com.ryuqq.resilience.core.config.ResilienceConfig;
import com.ryuqq.resilience.core.config.ResilienceSettings;
import com.ryuqq.resilience.core.config.ResilienceStrategy;
import com.ryuqq.resilience.core.exception.ServiceUnavailableException;
import com.ryuqq.resilience.core.metrics.ResilienceMetrics;
import com.ryuqq.resilience.core.operation.AsyncFallback;
import com.ryuqq.resilience.core.operation.AsyncOperation;
import com.ryuqq.resilience.core.operation.Fallback;
import com.ryuqq.resilience.core.operation.Operation;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerPermit;
import com.ryuqq.resilience.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.noop.NoOpCircuitBreaker;
import com.ryuqq.resilience.core.spi.CircuitBreakerRegistry;
import com.ryuqq.resilience.core.spi.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * {@link ResilienceOrchestrator} 기본 구현체.
 *
 * <p>인스턴스마다 자신의 metrics 저장소와 Circuit Breaker 테이블을 소유합니다.</p>
 *
 * <p><strong>호출 1회 처리 순서:</strong></p>
 * <ol>
 *   <li>{@link ConfigurationResolver}로 설정 결정 (호출마다 수행)</li>
 *   <li>Circuit Breaker 활성 시 {@link CircuitBreaker#tryAcquire()}로 허가를 받고, 거부되면
 *       {@link ServiceUnavailableException}을 fallback 경로로 전달 (operation 미실행)</li>
 *   <li>{@link RetryExecutor}로 operation 실행</li>
 *   <li>성공: operation metrics와 breaker에 성공 기록</li>
 *   <li>최종 실패: operation metrics와 breaker에 실패 기록 후 {@link FallbackExecutor}</li>
 * </ol>
 *
 * <p>결과는 항상 해당 호출이 받은 {@link CircuitBreakerPermit}과 함께 breaker에 보고됩니다.
 * {@link Error}는 기록 후 fallback 없이 그대로 전파되며, 비동기 호출에서는 실패한 future로 전달됩니다.</p>
 *
 * <p><strong>Metrics 기록 규칙:</strong></p>
 * <ul>
 *   <li>호출 1회당 totalCalls 1 증가, 최종 결과에 따라 successfulCalls 또는 failedCalls 1 증가</li>
 *   <li>retryAttempts는 재시도마다 1 증가</li>
 *   <li>Circuit OPEN 거부는 operation metrics에만 실패로 기록 (breaker 카운트에는 미반영)</li>
 *   <li>metrics 기록 실패는 경고 로그만 남기고 원래 결과/예외를 바꾸지 않음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ResilienceOrchestrator orchestrator = new DefaultResilienceOrchestrator();
 * orchestrator.registerOperation("payments", ResilienceStrategy.CONSERVATIVE);
 *
 * Operation&lt;PaymentRequest, Receipt&gt; pay = orchestrator
 *     .withResilience("payments")
 *     .decorate(gateway::pay, request -&gt; Receipt.pending(request));
 *
 * Receipt receipt = pay.apply(request);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DefaultResilienceOrchestrator implements ResilienceOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultResilienceOrchestrator.class);

    private final ConfigurationResolver resolver;
    private final MetricsRegistry metricsRegistry;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryExecutor retryExecutor;
    private final FallbackExecutor fallbackExecutor;
    private final HealthAggregator healthAggregator;
    private final Clock clock;
    private final ConcurrentMap<String, CircuitBreaker> noOpCircuitBreakers = new ConcurrentHashMap<>();

    /**
     * 기본 설정으로 생성 (외부 설정 없음, 실제 시간 대기).
     */
    public DefaultResilienceOrchestrator() {
        this(ResilienceSettings.NONE);
    }

    /**
     * 외부 설정을 지정하여 생성.
     *
     * @param settings operation별 전략 설정
     * @throws IllegalArgumentException settings가 null인 경우
     */
    public DefaultResilienceOrchestrator(ResilienceSettings settings) {
        this(settings, new DefaultExceptionClassifier(), new ThreadSleeper(), Clock.systemUTC());
    }

    /**
     * 분류기, 대기 전략, 시계를 지정하여 생성 (in-memory 저장소 사용).
     *
     * @param settings operation별 전략 설정
     * @param classifier 예외 분류기
     * @param sleeper 재시도 대기 전략
     * @param clock 시계
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public DefaultResilienceOrchestrator(
        ResilienceSettings settings,
        ExceptionClassifier classifier,
        Sleeper sleeper,
        Clock clock
    ) {
        this(settings, new InMemoryMetricsRegistry(), newCircuitBreakerRegistry(clock), classifier, sleeper, clock);
    }

    /**
     * 모든 협력 객체를 지정하여 생성.
     *
     * @param settings operation별 전략 설정
     * @param metricsRegistry operation metrics 저장소
     * @param circuitBreakerRegistry Circuit Breaker 테이블
     * @param classifier 예외 분류기
     * @param sleeper 재시도 대기 전략
     * @param clock 시계
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public DefaultResilienceOrchestrator(
        ResilienceSettings settings,
        MetricsRegistry metricsRegistry,
        CircuitBreakerRegistry circuitBreakerRegistry,
        ExceptionClassifier classifier,
        Sleeper sleeper,
        Clock clock
    ) {
        if (metricsRegistry == null) {
            throw new IllegalArgumentException("metricsRegistry cannot be null");
        }
        if (circuitBreakerRegistry == null) {
            throw new IllegalArgumentException("circuitBreakerRegistry cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.resolver = new ConfigurationResolver(settings);
        this.metricsRegistry = metricsRegistry;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.retryExecutor = new RetryExecutor(classifier, sleeper, clock);
        this.fallbackExecutor = new FallbackExecutor();
        this.healthAggregator = new HealthAggregator(circuitBreakerRegistry, metricsRegistry, clock);
        this.clock = clock;
    }

    private static CircuitBreakerRegistry newCircuitBreakerRegistry(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        return new InMemoryCircuitBreakerRegistry(clock);
    }

    // ============================================================
    // Registration
    // ============================================================

    @Override
    public void registerOperation(String operationName) {
        registerOperation(operationName, ConfigurationResolver.DEFAULT_STRATEGY);
    }

    @Override
    public void registerOperation(String operationName, ResilienceStrategy strategy) {
        resolver.register(operationName, strategy);
        log.info("Registered operation '{}' with strategy {}", operationName, strategy.value());
    }

    /**
     * 등록된 operation 전략 조회.
     *
     * @return operation 이름 → 전략 (복사본)
     */
    public Map<String, ResilienceStrategy> getRegisteredOperations() {
        return resolver.registeredOperations();
    }

    /**
     * 호출에 적용될 설정 미리보기.
     *
     * @param operationName operation 이름
     * @param strategy 전략 (nullable)
     * @param customConfig 사용자 설정 (nullable)
     * @return 결정된 설정
     */
    public ResilienceConfig resolveConfig(String operationName, ResilienceStrategy strategy, ResilienceConfig customConfig) {
        return resolver.resolve(operationName, strategy, customConfig);
    }

    // ============================================================
    // Decoration
    // ============================================================

    @Override
    public ResilienceDecorator withResilience(String operationName) {
        return withResilience(operationName, null, null);
    }

    @Override
    public ResilienceDecorator withResilience(String operationName, ResilienceStrategy strategy) {
        return withResilience(operationName, strategy, null);
    }

    @Override
    public ResilienceDecorator withResilience(
        String operationName,
        ResilienceStrategy strategy,
        ResilienceConfig customConfig
    ) {
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName cannot be null or blank");
        }
        return new OperationDecorator(operationName, strategy, customConfig);
    }

    // ============================================================
    // Metrics / Health
    // ============================================================

    @Override
    public ResilienceMetrics getMetrics(String operationName) {
        return metricsRegistry.getMetrics(operationName);
    }

    @Override
    public MetricsReport getAllMetrics() {
        Map<String, MetricsView> operations = new TreeMap<>();
        metricsRegistry.all().forEach((name, metrics) -> operations.put(name, MetricsView.from(metrics.snapshot())));

        Map<String, CircuitBreakerView> breakers = new TreeMap<>();
        int healthy = 0;
        for (Map.Entry<String, CircuitBreaker> entry : circuitBreakerRegistry.all().entrySet()) {
            CircuitBreakerSnapshot snapshot = entry.getValue().snapshot();
            breakers.put(entry.getKey(), CircuitBreakerView.from(snapshot));
            if (snapshot.state() != CircuitBreakerState.OPEN) {
                healthy++;
            }
        }

        String timestamp = clock.instant().toString();
        MetricsSummary summary = new MetricsSummary(operations.size(), breakers.size(), healthy, timestamp);
        return new MetricsReport(operations, breakers, summary, timestamp);
    }

    @Override
    public void resetMetrics() {
        metricsRegistry.resetAll();
        circuitBreakerRegistry.all().values().forEach(breaker -> breaker.getMetrics().reset());
        log.info("Reset metrics for all operations");
    }

    @Override
    public void resetMetrics(String operationName) {
        if (operationName == null) {
            resetMetrics();
            return;
        }
        metricsRegistry.reset(operationName);
        circuitBreakerRegistry.find(operationName).ifPresent(breaker -> breaker.getMetrics().reset());
        log.info("Reset metrics for operation '{}'", operationName);
    }

    /**
     * Circuit Breaker 조회 (생성하지 않음).
     *
     * @param operationName operation 이름
     * @return CircuitBreaker, 아직 호출된 적이 없거나 breaker가 비활성이면 empty
     */
    public Optional<CircuitBreaker> findCircuitBreaker(String operationName) {
        return circuitBreakerRegistry.find(operationName);
    }

    @Override
    public boolean isHealthy() {
        return healthAggregator.isHealthy();
    }

    @Override
    public HealthStatus getHealthStatus() {
        return healthAggregator.status();
    }

    // ============================================================
    // Execution
    // ============================================================

    private <T, R> R call(
        String operationName,
        ResilienceStrategy strategy,
        ResilienceConfig customConfig,
        Operation<T, R> operation,
        Fallback<T, R> fallback,
        T input
    ) throws Exception {
        ResilienceConfig config = resolver.resolve(operationName, strategy, customConfig);
        ResilienceMetrics metrics = metricsRegistry.getMetrics(operationName);
        CircuitBreaker breaker = circuitBreakerFor(operationName, config);

        Optional<CircuitBreakerPermit> acquired = breaker.tryAcquire();
        if (acquired.isEmpty()) {
            ServiceUnavailableException rejected = reject(operationName, breaker, metrics);
            return fallbackExecutor.execute(operationName, fallback, input, rejected);
        }
        CircuitBreakerPermit permit = acquired.get();

        R result;
        try {
            result = retryExecutor.execute(
                operationName,
                config.retryConfig(),
                config.enableRetry(),
                operation,
                input,
                retryListener(metrics)
            );
        } catch (Exception e) {
            onFailure(operationName, metrics, breaker, permit, e);
            return fallbackExecutor.execute(operationName, fallback, input, e);
        } catch (Error e) {
            onFailure(operationName, metrics, breaker, permit, e);
            throw e;
        }
        onSuccess(operationName, metrics, breaker, permit);
        return result;
    }

    private <T, R> CompletableFuture<R> callAsync(
        String operationName,
        ResilienceStrategy strategy,
        ResilienceConfig customConfig,
        AsyncOperation<T, R> operation,
        AsyncFallback<T, R> fallback,
        T input
    ) {
        ResilienceConfig config = resolver.resolve(operationName, strategy, customConfig);
        ResilienceMetrics metrics = metricsRegistry.getMetrics(operationName);
        CircuitBreaker breaker = circuitBreakerFor(operationName, config);

        Optional<CircuitBreakerPermit> acquired = breaker.tryAcquire();
        if (acquired.isEmpty()) {
            ServiceUnavailableException rejected = reject(operationName, breaker, metrics);
            return fallbackExecutor.executeAsync(operationName, fallback, input, rejected);
        }
        CircuitBreakerPermit permit = acquired.get();

        CompletableFuture<R> attempts;
        try {
            attempts = retryExecutor.executeAsync(
                operationName,
                config.retryConfig(),
                config.enableRetry(),
                operation,
                input,
                retryListener(metrics)
            );
        } catch (Throwable e) {
            attempts = CompletableFuture.failedFuture(e);
        }

        return attempts
            .handle((value, error) -> {
                if (error == null) {
                    onSuccess(operationName, metrics, breaker, permit);
                    return CompletableFuture.completedFuture(value);
                }
                Throwable cause = DefaultExceptionClassifier.unwrap(error);
                onFailure(operationName, metrics, breaker, permit, cause);
                if (cause instanceof Error) {
                    return CompletableFuture.<R>failedFuture(cause);
                }
                return fallbackExecutor.executeAsync(operationName, fallback, input, cause);
            })
            .thenCompose(Function.identity());
    }

    // breaker 비활성 operation은 이름마다 하나의 NoOp 인스턴스를 재사용
    CircuitBreaker circuitBreakerFor(String operationName, ResilienceConfig config) {
        if (!config.enableCircuitBreaker()) {
            return noOpCircuitBreakers.computeIfAbsent(operationName, NoOpCircuitBreaker::new);
        }
        return circuitBreakerRegistry.getOrCreate(operationName, config.circuitBreakerConfig());
    }

    private ServiceUnavailableException reject(String operationName, CircuitBreaker breaker, ResilienceMetrics metrics) {
        CircuitBreakerState state = breaker.getState();
        log.warn("Circuit breaker '{}' is {}, call rejected", operationName, state);
        recordSafely(operationName, () -> metrics.recordFailure(clock.instant()));
        return new ServiceUnavailableException(operationName, state);
    }

    private void onSuccess(
        String operationName,
        ResilienceMetrics metrics,
        CircuitBreaker breaker,
        CircuitBreakerPermit permit
    ) {
        recordSafely(operationName, () -> metrics.recordSuccess(clock.instant()));
        breaker.recordSuccess(permit);
    }

    private void onFailure(
        String operationName,
        ResilienceMetrics metrics,
        CircuitBreaker breaker,
        CircuitBreakerPermit permit,
        Throwable failure
    ) {
        recordSafely(operationName, () -> metrics.recordFailure(clock.instant()));
        breaker.recordFailure(permit, failure);
    }

    private RetryListener retryListener(ResilienceMetrics metrics) {
        return (operationName, attempt, delayMs, cause) ->
            recordSafely(operationName, metrics::recordRetryAttempt);
    }

    private static void recordSafely(String operationName, Runnable recorder) {
        try {
            recorder.run();
        } catch (RuntimeException e) {
            log.warn("Failed to record metrics for operation '{}'", operationName, e);
        }
    }

    /**
     * operation 하나에 묶인 decorator.
     *
     * <p>설정은 decorate 시점이 아니라 호출마다 결정되므로,
     * 이후의 operation 등록 변경도 다음 호출부터 반영됩니다.</p>
     */
    private final class OperationDecorator implements ResilienceDecorator {

        private final String operationName;
        private final ResilienceStrategy strategy;
        private final ResilienceConfig customConfig;

        private OperationDecorator(String operationName, ResilienceStrategy strategy, ResilienceConfig customConfig) {
            this.operationName = operationName;
            this.strategy = strategy;
            this.customConfig = customConfig;
        }

        @Override
        public String operationName() {
            return operationName;
        }

        @Override
        public <T, R> Operation<T, R> decorate(Operation<T, R> operation) {
            requireOperation(operation);
            return input -> call(operationName, strategy, customConfig, operation, null, input);
        }

        @Override
        public <T, R> Operation<T, R> decorate(Operation<T, R> operation, Fallback<T, R> fallback) {
            requireOperation(operation);
            requireFallback(fallback);
            return input -> call(operationName, strategy, customConfig, operation, fallback, input);
        }

        @Override
        public <T, R> AsyncOperation<T, R> decorateAsync(AsyncOperation<T, R> operation) {
            requireOperation(operation);
            return input -> callAsync(operationName, strategy, customConfig, operation, null, input);
        }

        @Override
        public <T, R> AsyncOperation<T, R> decorateAsync(AsyncOperation<T, R> operation, AsyncFallback<T, R> fallback) {
            requireOperation(operation);
            requireFallback(fallback);
            return input -> callAsync(operationName, strategy, customConfig, operation, fallback, input);
        }

        private void requireOperation(Object operation) {
            if (operation == null) {
                throw new IllegalArgumentException("operation cannot be null");
            }
        }

        private void requireFallback(Object fallback) {
            if (fallback == null) {
                throw new IllegalArgumentException("fallback cannot be null");
            }
        }
    }
}
