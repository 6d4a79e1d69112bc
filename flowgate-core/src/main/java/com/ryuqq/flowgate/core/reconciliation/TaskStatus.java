package com.ryuqq.flowgate.core.reconciliation;

/**
 * 검증 작업 상태.
 *
 * <pre>
 * PENDING ──► APPROVED (종료)
 *    └──────► REJECTED (종료)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TaskStatus {

    /**
     * 검토 대기.
     */
    PENDING,

    /**
     * 승인됨 (링크 저장, 종료 상태).
     */
    APPROVED,

    /**
     * 거부됨 (종료 상태).
     */
    REJECTED;

    /**
     * 종료 상태 여부.
     *
     * @return APPROVED 또는 REJECTED이면 true
     */
    public boolean isTerminal() {
        return this != PENDING;
    }
}
