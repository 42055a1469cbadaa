/**
 * 테스트용 시간 제어 도구.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.testkit.time;
