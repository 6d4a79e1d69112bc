/**
 * Protection SPI 패키지.
 *
 * <p>외부 의존성 호출을 감싸는 Flow Governor 계약을 정의합니다.
 * 하나의 {@link com.ryuqq.flowgate.core.protection.FlowGovernor}가 Circuit Breaker,
 * Rate Limiter(요청 수/토큰 수), Bulkhead(동시 실행 수)를 하나의 상태 객체로 관리합니다.</p>
 *
 * <h2>상태 소유권</h2>
 *
 * <p>Governor 상태는 프로세스당 하나이며 Governor 인스턴스가 독점합니다.
 * 다른 컴포넌트는 {@link com.ryuqq.flowgate.core.protection.GovernorSnapshot}으로만 관찰할 수 있습니다.
 * 프로세스 간/노드 간 조정은 제공하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see com.ryuqq.flowgate.core.protection.FlowGovernor
 * @see com.ryuqq.flowgate.core.admission.Admission
 */
package com.ryuqq.flowgate.core.protection;
