/**
 * Reconciliation Application Layer.
 *
 * <p>{@link com.ryuqq.flowgate.application.reconciliation.ReconciliationEngine} 포트를 정의합니다.
 * 저장소 기반 구현체는 adapter-runner 모듈에 위치합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flowgate.application.reconciliation;
