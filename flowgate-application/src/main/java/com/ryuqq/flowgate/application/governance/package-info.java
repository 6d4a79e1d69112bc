/**
 * Governance Application Layer - 보호 호출 API.
 *
 * <ul>
 *   <li>{@link com.ryuqq.flowgate.application.governance.GovernedInvoker} - acquire/release 범위 실행기</li>
 *   <li>{@link com.ryuqq.flowgate.application.governance.GovernedCall} - 보호 대상 호출</li>
 *   <li>{@link com.ryuqq.flowgate.application.governance.GovernanceRejectedException} - 거부 신호</li>
 * </ul>
 *
 * <p>구현체는 adapter-runner 모듈에 위치합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flowgate.application.governance;
