package com.ryuqq.flowgate.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p>Circuit Breaker는 외부 의존성 호출의 연속 실패를 추적하고,
 * 임계값 도달 시 요청을 차단하여 장애 전파를 방지합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 failureThreshold 도달)
 * OPEN (차단)
 *   │
 *   ▼ (recoveryTimeoutMs 경과 후 첫 acquire)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► 연속 성공 successThreshold 도달 → CLOSED
 *   └─► 실패 → OPEN
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>요청은 Rate Limit 검사만 거쳐 통과하며, 연속 실패 수를 추적합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>recoveryTimeoutMs 동안 모든 acquire가 retryAfterMs 힌트와 함께 거부됩니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (복구 확인용 요청 통과).
     *
     * <p>연속 성공이 successThreshold에 도달하면 CLOSED, 실패하면 다시 OPEN으로 전이합니다.</p>
     */
    HALF_OPEN
}
