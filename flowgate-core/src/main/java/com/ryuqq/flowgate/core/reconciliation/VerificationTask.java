package com.ryuqq.flowgate.core.reconciliation;

import java.util.List;

/**
 * 사람이 검토하는 검증 작업 (영속 객체).
 *
 * <p>후보 점수가 자동 링크하기엔 불확실하지만 버리기엔 그럴듯한 경우에 생성됩니다.
 * PENDING으로 생성되어 APPROVED 또는 REJECTED로 정확히 한 번 전이하며, 종료 상태는 다시 열리지 않습니다.</p>
 *
 * @param id 작업 ID
 * @param entityIri 대상 엔티티 IRI
 * @param label 검색에 사용된 레이블
 * @param candidates 검토 대상 후보 (점수 내림차순)
 * @param createdAt 생성 시각 (epoch ms)
 * @param status 작업 상태
 * @param approvedId 승인된 외부 식별자 (APPROVED일 때만, 그 외 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record VerificationTask(
    String id,
    String entityIri,
    String label,
    List<Candidate> candidates,
    long createdAt,
    TaskStatus status,
    String approvedId
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public VerificationTask {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (entityIri == null || entityIri.isBlank()) {
            throw new IllegalArgumentException("entityIri cannot be null or blank");
        }
        if (label == null) {
            throw new IllegalArgumentException("label cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (status == TaskStatus.APPROVED && (approvedId == null || approvedId.isBlank())) {
            throw new IllegalArgumentException("approvedId is required for APPROVED task");
        }
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    /**
     * PENDING 작업 생성.
     *
     * @param id 작업 ID
     * @param entityIri 엔티티 IRI
     * @param label 레이블
     * @param candidates 후보 목록
     * @param createdAt 생성 시각 (epoch ms)
     * @return PENDING 상태 작업
     */
    public static VerificationTask pending(
        String id,
        String entityIri,
        String label,
        List<Candidate> candidates,
        long createdAt
    ) {
        return new VerificationTask(id, entityIri, label, candidates, createdAt, TaskStatus.PENDING, null);
    }

    /**
     * 승인된 작업으로 전이.
     *
     * @param chosenId 선택된 외부 식별자
     * @return APPROVED 상태의 새 인스턴스
     * @throws IllegalStateException 이미 종료 상태인 경우
     */
    public VerificationTask approvedWith(String chosenId) {
        requirePending("approve");
        return new VerificationTask(id, entityIri, label, candidates, createdAt, TaskStatus.APPROVED, chosenId);
    }

    /**
     * 거부된 작업으로 전이.
     *
     * @return REJECTED 상태의 새 인스턴스
     * @throws IllegalStateException 이미 종료 상태인 경우
     */
    public VerificationTask rejected() {
        requirePending("reject");
        return new VerificationTask(id, entityIri, label, candidates, createdAt, TaskStatus.REJECTED, null);
    }

    private void requirePending(String action) {
        if (status.isTerminal()) {
            throw new IllegalStateException(
                "Cannot " + action + " task " + id + " in terminal state " + status
            );
        }
    }
}
