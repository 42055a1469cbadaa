package com.ryuqq.resilience.core.classification;

/**
 * 예외 분류 함수.
 *
 * <p>Retry Engine을 특정 예외 계층으로부터 분리합니다.
 * 구현체는 어떤 예외든 {@link Transient} 또는 {@link Permanent}로 매핑해야 하며,
 * 예외를 던지지 않아야 합니다.</p>
 *
 * <pre>{@code
 * ExceptionClassifier classifier = e -> e instanceof MyBackendBusyException
 *     ? new Transient("backend busy")
 *     : new Permanent(e.getClass().getSimpleName());
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ExceptionClassifier {

    /**
     * 예외 분류.
     *
     * @param throwable 실패 원인 (null 가능)
     * @return 분류 결과
     */
    Classification classify(Throwable throwable);
}
