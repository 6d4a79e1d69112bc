package com.ryuqq.flowgate.core.admission;

/**
 * Circuit Breaker OPEN으로 거부됨.
 *
 * <p>연속 실패가 임계값에 도달하여 차단 중입니다.
 * retryAfterMs는 recoveryTimeoutMs까지 남은 시간입니다.</p>
 *
 * @param retryAfterMs 재시도까지 대기 시간 (밀리초, 0 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CircuitOpen(long retryAfterMs) implements Admission {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException retryAfterMs가 음수인 경우
     */
    public CircuitOpen {
        if (retryAfterMs < 0) {
            throw new IllegalArgumentException("retryAfterMs must be non-negative (current: " + retryAfterMs + ")");
        }
    }
}
