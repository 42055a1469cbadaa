package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.classification.Classification;
import com.ryuqq.resilience.core.classification.DefaultExceptionClassifier;
import com.ryuqq.resilience.core.classification.ExceptionClassifier;
import com.ryuqq.resilience.core.config.RetryConfig;
import com.ryuqq.resilience.core.exception.RetryExhaustedException;
import com.ryuqq.resilience.core.operation.AsyncOperation;
import com.ryuqq.resilience.core.operation.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 재시도 엔진.
 *
 * <p>실패를 {@link ExceptionClassifier}로 분류하여 일시적 오류만 재시도합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>retry 비활성: operation을 한 번만 호출하고 예외를 그대로 전파</li>
 *   <li>영구 오류: 추가 시도 없이 원래 예외 전파</li>
 *   <li>일시적 오류: {@link BackoffCalculator}가 계산한 시간만큼 대기 후 재시도</li>
 *   <li>maxAttempts 도달 또는 첫 시도 이후 maxDelaySeconds 경과:
 *       마지막 예외를 감싼 {@link RetryExhaustedException}</li>
 * </ol>
 *
 * <p>비동기 경로의 대기는 {@link Sleeper#sleepAsync(long)}로 수행되어 스레드를 점유하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final ExceptionClassifier classifier;
    private final Sleeper sleeper;
    private final Clock clock;
    private final DoubleSupplier random;

    /**
     * 생성자 (기본 난수 생성기).
     *
     * @param classifier 예외 분류기
     * @param sleeper 대기 전략
     * @param clock maxDelaySeconds 판정용 시계
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public RetryExecutor(ExceptionClassifier classifier, Sleeper sleeper, Clock clock) {
        this(classifier, sleeper, clock, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 생성자.
     *
     * @param classifier 예외 분류기
     * @param sleeper 대기 전략
     * @param clock maxDelaySeconds 판정용 시계
     * @param random jitter 난수 공급자
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public RetryExecutor(ExceptionClassifier classifier, Sleeper sleeper, Clock clock, DoubleSupplier random) {
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.classifier = classifier;
        this.sleeper = sleeper;
        this.clock = clock;
        this.random = random;
    }

    /**
     * 동기 실행.
     *
     * @param operationName operation 이름 (로그, 예외 메시지용)
     * @param config 재시도 설정
     * @param enableRetry false면 한 번만 호출
     * @param operation 실행할 operation
     * @param input 입력
     * @param listener 재시도 알림 (nullable)
     * @param <T> 입력 타입
     * @param <R> 결과 타입
     * @return operation 결과
     * @throws RetryExhaustedException 일시적 오류로 시도가 소진된 경우
     * @throws InterruptedException 재시도 대기 중 인터럽트된 경우 (인터럽트 플래그 복원됨)
     * @throws Exception 영구 오류, 또는 retry 비활성 시 operation이 던진 예외
     */
    public <T, R> R execute(
        String operationName,
        RetryConfig config,
        boolean enableRetry,
        Operation<T, R> operation,
        T input,
        RetryListener listener
    ) throws Exception {
        if (!enableRetry) {
            return operation.apply(input);
        }

        RetryListener retryListener = listener == null ? RetryListener.NONE : listener;
        BackoffCalculator backoff = new BackoffCalculator(config, random);
        Instant startedAt = clock.instant();
        int attempt = 0;

        while (true) {
            attempt++;
            try {
                return operation.apply(input);
            } catch (Exception e) {
                Classification classification = classifier.classify(e);
                if (classification.isPermanent()) {
                    log.debug("Operation '{}' failed permanently on attempt {}: {}",
                        operationName, attempt, classification.reason());
                    throw e;
                }
                if (isExhausted(config, attempt, startedAt)) {
                    log.error("Operation '{}' exhausted retries after {} attempts: {}",
                        operationName, attempt, describe(e));
                    throw new RetryExhaustedException(operationName, attempt, e);
                }

                long delayMs = backoff.calculate(attempt);
                notifyRetry(retryListener, operationName, attempt, delayMs, e, config);
                try {
                    sleeper.sleep(delayMs);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    interrupted.addSuppressed(e);
                    throw interrupted;
                }
            }
        }
    }

    /**
     * 비동기 실행.
     *
     * <p>반환된 future의 예외는 {@link java.util.concurrent.CompletionException}으로 감싸지지 않은
     * 원래 원인입니다. operation이 stage를 반환하지 않고 직접 던진 예외나 {@link Error}도
     * 이 메서드 밖으로 전파되지 않고 future의 실패로 전달되며, 반환된 future는 항상 완료됩니다.
     * {@link Error}는 재시도하지 않습니다.</p>
     *
     * @param operationName operation 이름 (로그, 예외 메시지용)
     * @param config 재시도 설정
     * @param enableRetry false면 한 번만 호출
     * @param operation 실행할 operation
     * @param input 입력
     * @param listener 재시도 알림 (nullable)
     * @param <T> 입력 타입
     * @param <R> 결과 타입
     * @return 결과 future
     */
    public <T, R> CompletableFuture<R> executeAsync(
        String operationName,
        RetryConfig config,
        boolean enableRetry,
        AsyncOperation<T, R> operation,
        T input,
        RetryListener listener
    ) {
        CompletableFuture<R> result = new CompletableFuture<>();
        AsyncAttempt<T, R> context = new AsyncAttempt<>(
            operationName,
            config,
            enableRetry,
            operation,
            input,
            listener == null ? RetryListener.NONE : listener,
            new BackoffCalculator(config, random),
            clock.instant(),
            result
        );
        attemptAsync(context, 1);
        return result;
    }

    private <T, R> void attemptAsync(AsyncAttempt<T, R> context, int attempt) {
        CompletionStage<R> stage;
        try {
            stage = context.operation.apply(context.input);
            if (stage == null) {
                throw new IllegalStateException("Operation '" + context.operationName + "' returned null stage");
            }
        } catch (Throwable e) {
            stage = CompletableFuture.failedFuture(e);
        }

        stage.whenComplete((value, error) -> {
            if (error == null) {
                context.result.complete(value);
                return;
            }
            try {
                onAsyncFailure(context, attempt, DefaultExceptionClassifier.unwrap(error));
            } catch (Throwable unexpected) {
                log.error("Retry handling failed for operation '{}' on attempt {}",
                    context.operationName, attempt, unexpected);
                if (unexpected != error) {
                    unexpected.addSuppressed(error);
                }
                context.result.completeExceptionally(unexpected);
            }
        });
    }

    private <T, R> void onAsyncFailure(AsyncAttempt<T, R> context, int attempt, Throwable cause) {
        if (!context.enableRetry || cause instanceof Error) {
            context.result.completeExceptionally(cause);
            return;
        }
        Classification classification = classifier.classify(cause);
        if (classification.isPermanent()) {
            log.debug("Operation '{}' failed permanently on attempt {}: {}",
                context.operationName, attempt, classification.reason());
            context.result.completeExceptionally(cause);
            return;
        }
        if (isExhausted(context.config, attempt, context.startedAt)) {
            log.error("Operation '{}' exhausted retries after {} attempts: {}",
                context.operationName, attempt, describe(cause));
            context.result.completeExceptionally(new RetryExhaustedException(context.operationName, attempt, cause));
            return;
        }

        long delayMs = context.backoff.calculate(attempt);
        notifyRetry(context.listener, context.operationName, attempt, delayMs, cause, context.config);
        sleeper.sleepAsync(delayMs).whenComplete((ignored, sleepError) -> {
            if (sleepError != null) {
                sleepError.addSuppressed(cause);
                context.result.completeExceptionally(sleepError);
                return;
            }
            try {
                attemptAsync(context, attempt + 1);
            } catch (Throwable unexpected) {
                if (unexpected != cause) {
                    unexpected.addSuppressed(cause);
                }
                context.result.completeExceptionally(unexpected);
            }
        });
    }

    private boolean isExhausted(RetryConfig config, int attempt, Instant startedAt) {
        if (attempt >= config.maxAttempts()) {
            return true;
        }
        Duration elapsed = Duration.between(startedAt, clock.instant());
        return elapsed.compareTo(Duration.ofSeconds(config.maxDelaySeconds())) >= 0;
    }

    private static void notifyRetry(
        RetryListener listener,
        String operationName,
        int attempt,
        long delayMs,
        Throwable cause,
        RetryConfig config
    ) {
        log.warn("Retrying operation '{}' (attempt {}/{}) in {} ms after {}",
            operationName, attempt, config.maxAttempts(), delayMs, describe(cause));
        try {
            listener.onRetry(operationName, attempt, delayMs, cause);
        } catch (RuntimeException e) {
            log.warn("Retry listener failed for operation '{}'", operationName, e);
        }
    }

    private static String describe(Throwable throwable) {
        return throwable.getClass().getSimpleName() + ": " + throwable.getMessage();
    }

    private static final class AsyncAttempt<T, R> {

        private final String operationName;
        private final RetryConfig config;
        private final boolean enableRetry;
        private final AsyncOperation<T, R> operation;
        private final T input;
        private final RetryListener listener;
        private final BackoffCalculator backoff;
        private final Instant startedAt;
        private final CompletableFuture<R> result;

        private AsyncAttempt(
            String operationName,
            RetryConfig config,
            boolean enableRetry,
            AsyncOperation<T, R> operation,
            T input,
            RetryListener listener,
            BackoffCalculator backoff,
            Instant startedAt,
            CompletableFuture<R> result
        ) {
            this.operationName = operationName;
            this.config = config;
            this.enableRetry = enableRetry;
            this.operation = operation;
            this.input = input;
            this.listener = listener;
            this.backoff = backoff;
            this.startedAt = startedAt;
            this.result = result;
        }
    }
}
