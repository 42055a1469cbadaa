package com.ryuqq.resilience.core.classification;

/**
 * 예외 분류 결과.
 *
 * <p>Retry Engine은 실패한 시도마다 예외를 이 타입으로 변환하여 재시도 여부를 결정합니다.</p>
 * <ul>
 *   <li>{@link Transient}: 일시적 실패, 재시도 가능</li>
 *   <li>{@link Permanent}: 영구적 실패, 재시도 불가</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 두 가지 경우만 존재합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Classification permits Transient, Permanent {

    /**
     * 분류 사유.
     *
     * @return 사유
     */
    String reason();

    /**
     * 재시도 가능한 실패인지 확인.
     *
     * @return 재시도 가능 여부
     */
    default boolean isTransient() {
        return this instanceof Transient;
    }

    /**
     * 영구 실패인지 확인.
     *
     * @return 영구 실패 여부
     */
    default boolean isPermanent() {
        return this instanceof Permanent;
    }
}
