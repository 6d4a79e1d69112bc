package com.ryuqq.flowgate.core.admission;

/**
 * Rate Limit 거부 사유.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RateLimitReason {

    /**
     * 윈도우당 요청 수 초과.
     */
    REQUESTS,

    /**
     * 윈도우당 토큰 수 초과.
     */
    TOKENS
}
