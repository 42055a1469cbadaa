/**
 * Resilience Application Layer - operation 보호 API.
 *
 * <p>이 패키지는 외부 서비스 호출을 재시도, Circuit Breaker, metrics, fallback으로
 * 감싸는 공개 API를 정의합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.resilience.application.orchestrator.ResilienceOrchestrator} - 정책 조정자, 조회/초기화 API</li>
 *   <li>{@link com.ryuqq.resilience.application.orchestrator.ResilienceDecorator} - operation 단위 decorator</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 *   <li><strong>명시적 인스턴스:</strong> 전역 singleton 없이 orchestrator를 생성하여 전달</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.orchestrator;
