package com.ryuqq.resilience.core.protection;

import java.util.Locale;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 수가 failureThreshold 도달)
 * OPEN (차단)
 *   │
 *   ▼ (recoveryTimeout 경과 후 다음 호출)
 * HALF_OPEN (시험 호출 1건 허용)
 *   │
 *   ├─► 성공 → CLOSED
 *   └─► 실패 → OPEN
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>모든 요청이 통과하며 연속 실패 수를 추적합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>감싸진 operation을 실행하지 않고 즉시 거부합니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (시험 호출 1건만 통과).
     *
     * <p>시험 호출이 성공하면 CLOSED, 실패하면 다시 OPEN으로 전이합니다.
     * 상태 집계에서는 healthy로 취급합니다.</p>
     */
    HALF_OPEN;

    /**
     * 외부 노출용 소문자 이름.
     *
     * @return "closed", "open", "half_open"
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
