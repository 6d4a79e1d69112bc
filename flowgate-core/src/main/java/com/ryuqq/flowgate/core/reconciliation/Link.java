package com.ryuqq.flowgate.core.reconciliation;

/**
 * 엔티티 IRI → 외부 식별자 링크 (영속 객체).
 *
 * <p>자동 링크 또는 검증 작업 승인의 영속적 결과입니다.</p>
 *
 * @param entityIri 엔티티 IRI
 * @param externalId 외부 레지스트리 식별자
 * @param externalUri 외부 엔티티 URI
 * @param linkedAt 링크 생성 시각 (epoch ms)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Link(String entityIri, String externalId, String externalUri, long linkedAt) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public Link {
        if (entityIri == null || entityIri.isBlank()) {
            throw new IllegalArgumentException("entityIri cannot be null or blank");
        }
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("externalId cannot be null or blank");
        }
        if (externalUri == null || externalUri.isBlank()) {
            throw new IllegalArgumentException("externalUri cannot be null or blank");
        }
    }
}
