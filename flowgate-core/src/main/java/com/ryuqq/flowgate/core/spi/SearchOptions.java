package com.ryuqq.flowgate.core.spi;

/**
 * 후보 검색 옵션.
 *
 * @param language 검색 언어 (예: "en")
 * @param limit 최대 후보 수 (양수)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SearchOptions(String language, int limit) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public SearchOptions {
        if (language == null || language.isBlank()) {
            throw new IllegalArgumentException("language cannot be null or blank");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
    }
}
