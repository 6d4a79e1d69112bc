package com.ryuqq.flowgate.core.reconciliation;

import java.util.List;
import java.util.Optional;

/**
 * Reconciliation 결과.
 *
 * @param entityIri 엔티티 IRI
 * @param label 검색 레이블
 * @param decision 결정
 * @param candidates 검토된 후보 (SKIPPED 또는 후보 없음이면 빈 목록)
 * @param bestMatch 최선 후보 (null 가능)
 * @param verificationTaskId 생성된 검증 작업 ID (QUEUED일 때만, 그 외 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ReconciliationResult(
    String entityIri,
    String label,
    ReconciliationDecision decision,
    List<Candidate> candidates,
    Candidate bestMatch,
    String verificationTaskId
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public ReconciliationResult {
        if (entityIri == null) {
            throw new IllegalArgumentException("entityIri cannot be null");
        }
        if (decision == null) {
            throw new IllegalArgumentException("decision cannot be null");
        }
        if (decision == ReconciliationDecision.QUEUED && verificationTaskId == null) {
            throw new IllegalArgumentException("verificationTaskId is required for QUEUED decision");
        }
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static ReconciliationResult skipped(String entityIri, String label) {
        return new ReconciliationResult(entityIri, label, ReconciliationDecision.SKIPPED, List.of(), null, null);
    }

    public static ReconciliationResult noMatch(String entityIri, String label, List<Candidate> candidates) {
        Candidate best = candidates == null || candidates.isEmpty() ? null : candidates.get(0);
        return new ReconciliationResult(entityIri, label, ReconciliationDecision.NO_MATCH, candidates, best, null);
    }

    public static ReconciliationResult autoLinked(String entityIri, String label, List<Candidate> candidates) {
        return new ReconciliationResult(
            entityIri, label, ReconciliationDecision.AUTO_LINKED, candidates, candidates.get(0), null);
    }

    public static ReconciliationResult queued(
        String entityIri,
        String label,
        List<Candidate> candidates,
        String verificationTaskId
    ) {
        return new ReconciliationResult(
            entityIri, label, ReconciliationDecision.QUEUED, candidates, candidates.get(0), verificationTaskId);
    }

    /**
     * 최선 후보 조회.
     *
     * @return 최선 후보 (없으면 empty)
     */
    public Optional<Candidate> findBestMatch() {
        return Optional.ofNullable(bestMatch);
    }
}
