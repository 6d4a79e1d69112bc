package com.ryuqq.flowgate.core.protection;

/**
 * Flow Governor 상태 스냅샷.
 *
 * <p>{@link FlowGovernor#metrics()} 호출 시점의 상태를 복사한 불변 값입니다.
 * 스냅샷을 수정해도 Governor 내부 상태에는 영향이 없습니다.</p>
 *
 * <p><strong>불변식:</strong> consecutiveFailures와 consecutiveSuccesses 중 최대 하나만 0이 아닙니다.</p>
 *
 * @param requestsInWindow 현재 윈도우 요청 수
 * @param tokensInWindow 현재 윈도우 토큰 수
 * @param windowStart 현재 윈도우 시작 시각 (epoch ms)
 * @param circuitState Circuit Breaker 상태
 * @param consecutiveFailures 연속 실패 수
 * @param consecutiveSuccesses 연속 성공 수
 * @param circuitOpenedAt 마지막 OPEN 전이 시각 (epoch ms, OPEN된 적 없으면 0)
 * @param inFlight 승인 후 아직 release되지 않은 호출 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record GovernorSnapshot(
    int requestsInWindow,
    long tokensInWindow,
    long windowStart,
    CircuitBreakerState circuitState,
    int consecutiveFailures,
    int consecutiveSuccesses,
    long circuitOpenedAt,
    int inFlight
) {
}
