package com.ryuqq.flowgate.core.reconciliation;

/**
 * 외부 레지스트리 후보.
 *
 * <p>엔티티 레이블 검색 결과로 반환되는 순위 후보이며, 0~100 신뢰도 점수를 가집니다.</p>
 *
 * @param id 외부 레지스트리 식별자 (예: Q312)
 * @param score 신뢰도 점수 (0~100)
 * @param label 후보 레이블
 * @param description 후보 설명 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Candidate(String id, double score, String label, String description) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Candidate {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (Double.isNaN(score) || score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be between 0 and 100 (current: " + score + ")");
        }
        if (label == null) {
            throw new IllegalArgumentException("label cannot be null");
        }
        // description은 null 허용
    }

    /**
     * 설명 없이 Candidate 생성.
     *
     * @param id 외부 식별자
     * @param score 신뢰도 점수
     * @param label 레이블
     * @return Candidate 인스턴스
     */
    public static Candidate of(String id, double score, String label) {
        return new Candidate(id, score, label, null);
    }
}
