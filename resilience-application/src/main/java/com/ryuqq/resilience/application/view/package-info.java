/**
 * 조회 API 반환용 불변 record.
 *
 * <p>모든 시각은 ISO-8601 문자열로 노출됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.view;
