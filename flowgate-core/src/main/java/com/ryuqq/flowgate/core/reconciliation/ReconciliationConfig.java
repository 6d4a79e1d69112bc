package com.ryuqq.flowgate.core.reconciliation;

/**
 * Reconciliation 설정 (불변 record).
 *
 * <p><strong>결정 구간:</strong></p>
 * <pre>
 * 100 ┬──────────────────
 *     │ AUTO_LINKED       score ≥ autoLinkThreshold
 *  90 ├──────────────────
 *     │ QUEUED            queueThreshold ≤ score &lt; autoLinkThreshold
 *  50 ├──────────────────
 *     │ NO_MATCH          score &lt; queueThreshold
 *   0 ┴──────────────────
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param autoLinkThreshold 자동 링크 최소 점수 (0~100, 기본 90)
 * @param queueThreshold 검토 대기열 최소 점수 (0~100, 기본 50)
 * @param maxCandidates 검색할 최대 후보 수 (양수, 기본 5)
 * @param language 검색 언어 (기본 "en")
 */
public record ReconciliationConfig(
    double autoLinkThreshold,
    double queueThreshold,
    int maxCandidates,
    String language
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: autoLinkThreshold=90, queueThreshold=50, maxCandidates=5, language="en"</p>
     */
    public ReconciliationConfig() {
        this(90, 50, 5, "en");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * <p>autoLinkThreshold가 queueThreshold보다 작으면 QUEUED 구간이 사라지고
     * 결정이 뒤집히므로 생성 시점에 거부합니다.</p>
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ReconciliationConfig {
        requireScore("autoLinkThreshold", autoLinkThreshold);
        requireScore("queueThreshold", queueThreshold);
        if (autoLinkThreshold < queueThreshold) {
            throw new IllegalArgumentException(
                "autoLinkThreshold must be >= queueThreshold (autoLink: " + autoLinkThreshold
                    + ", queue: " + queueThreshold + ")"
            );
        }
        if (maxCandidates <= 0) {
            throw new IllegalArgumentException("maxCandidates must be positive (current: " + maxCandidates + ")");
        }
        if (language == null || language.isBlank()) {
            throw new IllegalArgumentException("language cannot be null or blank");
        }
    }

    private static void requireScore(String name, double value) {
        if (Double.isNaN(value) || value < 0 || value > 100) {
            throw new IllegalArgumentException(name + " must be between 0 and 100 (current: " + value + ")");
        }
    }

    public ReconciliationConfig withAutoLinkThreshold(double autoLinkThreshold) {
        return new ReconciliationConfig(autoLinkThreshold, queueThreshold, maxCandidates, language);
    }

    public ReconciliationConfig withQueueThreshold(double queueThreshold) {
        return new ReconciliationConfig(autoLinkThreshold, queueThreshold, maxCandidates, language);
    }

    public ReconciliationConfig withMaxCandidates(int maxCandidates) {
        return new ReconciliationConfig(autoLinkThreshold, queueThreshold, maxCandidates, language);
    }

    public ReconciliationConfig withLanguage(String language) {
        return new ReconciliationConfig(autoLinkThreshold, queueThreshold, maxCandidates, language);
    }
}
