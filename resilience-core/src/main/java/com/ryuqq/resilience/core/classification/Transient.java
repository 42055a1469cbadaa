package com.ryuqq.resilience.core.classification;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>네트워크 타임아웃, 연결 거부/리셋</li>
 *   <li>외부 서비스 일시 장애 (502, 503, 504)</li>
 *   <li>Rate Limit 초과 (429 Too Many Requests)</li>
 * </ul>
 *
 * @param reason 분류 사유
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Transient(String reason) implements Classification {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException reason이 null이거나 빈 문자열인 경우
     */
    public Transient {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }
}
