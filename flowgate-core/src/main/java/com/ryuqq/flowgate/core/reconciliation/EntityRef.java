package com.ryuqq.flowgate.core.reconciliation;

import java.util.List;

/**
 * 일괄 Reconciliation 입력 항목.
 *
 * @param iri 엔티티 IRI
 * @param label 검색 레이블
 * @param types 엔티티 타입 IRI 목록 (null이면 빈 목록)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EntityRef(String iri, String label, List<String> types) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException iri 또는 label이 유효하지 않은 경우
     */
    public EntityRef {
        if (iri == null || iri.isBlank()) {
            throw new IllegalArgumentException("iri cannot be null or blank");
        }
        if (label == null) {
            throw new IllegalArgumentException("label cannot be null");
        }
        types = types == null ? List.of() : List.copyOf(types);
    }

    /**
     * 타입 없이 EntityRef 생성.
     *
     * @param iri 엔티티 IRI
     * @param label 검색 레이블
     * @return EntityRef 인스턴스
     */
    public static EntityRef of(String iri, String label) {
        return new EntityRef(iri, label, List.of());
    }
}
