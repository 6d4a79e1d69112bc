package com.ryuqq.flowgate.core.spi;

/**
 * 외부 레지스트리의 Rate Limit 초과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SearchRateLimitedException extends CandidateSearchException {

    private final long retryAfterMs;

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param retryAfterMs 레지스트리가 제시한 재시도 대기 시간 (밀리초, 알 수 없으면 0)
     */
    public SearchRateLimitedException(String message, long retryAfterMs) {
        super(message);
        this.retryAfterMs = Math.max(0, retryAfterMs);
    }

    public long getRetryAfterMs() {
        return retryAfterMs;
    }
}
