package com.ryuqq.flowgate.core.admission;

/**
 * Rate Limit 초과로 거부됨.
 *
 * <p>현재 윈도우의 요청 수 또는 토큰 수 한도를 초과했습니다.
 * retryAfterMs는 현재 윈도우가 끝날 때까지 남은 시간입니다.</p>
 *
 * @param reason 거부 사유 (REQUESTS 또는 TOKENS)
 * @param retryAfterMs 재시도까지 대기 시간 (밀리초, 0 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RateLimited(RateLimitReason reason, long retryAfterMs) implements Admission {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public RateLimited {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (retryAfterMs < 0) {
            throw new IllegalArgumentException("retryAfterMs must be non-negative (current: " + retryAfterMs + ")");
        }
    }
}
