/**
 * Entity Reconciliation 도메인 패키지.
 *
 * <p>엔티티 레이블을 외부 레지스트리에 대조하여 세 갈래 결정(자동 링크, 검토 대기, 불일치)을 내리고,
 * 검토 대기 건을 영속적인 {@link com.ryuqq.flowgate.core.reconciliation.VerificationTask}로 관리하기 위한
 * 불변 모델을 정의합니다.</p>
 *
 * <p><strong>주요 타입:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.flowgate.core.reconciliation.ReconciliationConfig}: 임계값 설정</li>
 *   <li>{@link com.ryuqq.flowgate.core.reconciliation.ReconciliationResult}: 호출 결과</li>
 *   <li>{@link com.ryuqq.flowgate.core.reconciliation.Link}: 영속 링크</li>
 *   <li>{@link com.ryuqq.flowgate.core.reconciliation.ReconciliationException}: 기록 실패</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flowgate.core.reconciliation;
