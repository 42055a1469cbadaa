package com.ryuqq.resilience.core.classification;

/**
 * 영구적 실패 (재시도 불가).
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>유효성 검증 실패 (잘못된 입력)</li>
 *   <li>인증/권한 오류 (401, 403)</li>
 *   <li>리소스 없음 (404 Not Found)</li>
 *   <li>분류할 수 없는 예외 (보수적으로 영구 실패 처리)</li>
 * </ul>
 *
 * @param reason 분류 사유
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Permanent(String reason) implements Classification {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException reason이 null이거나 빈 문자열인 경우
     */
    public Permanent {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }
}
