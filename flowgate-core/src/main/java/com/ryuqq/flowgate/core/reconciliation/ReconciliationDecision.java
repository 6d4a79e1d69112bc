package com.ryuqq.flowgate.core.reconciliation;

/**
 * Reconciliation 결정.
 *
 * <p><strong>상태 흐름 (호출당 1회):</strong></p>
 * <pre>
 * Start ─► 기존 링크 있음? ─► SKIPPED
 *       ─► 레지스트리 검색
 *            ├─► 후보 없음 ─► NO_MATCH
 *            ├─► best ≥ autoLinkThreshold ─► 링크 저장 ─► AUTO_LINKED
 *            ├─► best ≥ queueThreshold ─► 검증 작업 생성 ─► QUEUED
 *            └─► 그 외 ─► NO_MATCH (후보는 결과에 유지)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ReconciliationDecision {

    /**
     * 최선 후보가 자동 링크 임계값 이상 → 링크 저장됨.
     */
    AUTO_LINKED,

    /**
     * 최선 후보가 검토 구간 → PENDING 검증 작업 생성됨.
     */
    QUEUED,

    /**
     * 후보 없음 또는 검토 임계값 미만 → 영속화 부작용 없음.
     */
    NO_MATCH,

    /**
     * 이미 링크가 존재함 → 검색 호출 없이 종료.
     */
    SKIPPED
}
