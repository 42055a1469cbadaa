/**
 * 설정 결정 (custom &gt; strategy &gt; 등록 &gt; 외부 설정 &gt; BALANCED).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.resolve;
