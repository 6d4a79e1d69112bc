package com.ryuqq.flowgate.core.admission;

/**
 * Flow Governor 승인 결과.
 *
 * <p>Admission은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Admitted}: 승인됨, 호출 후 반드시 release 필요</li>
 *   <li>{@link RateLimited}: 요청 수 또는 토큰 수 초과, 재시도 가능</li>
 *   <li>{@link CircuitOpen}: Circuit Breaker 차단 중, 재시도 가능</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.
 * 거부 결과는 항상 {@link #retryAfterMs()} 힌트를 제공하며, 이 코어 내부에서 치명적 오류로
 * 격상되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Admission permits Admitted, RateLimited, CircuitOpen {

    /**
     * 재시도까지 권장 대기 시간.
     *
     * @return 대기 시간 (밀리초, 승인된 경우 0)
     */
    long retryAfterMs();

    /**
     * 승인 여부 확인.
     *
     * @return 승인 여부
     */
    default boolean isAdmitted() {
        return this instanceof Admitted;
    }

    /**
     * Rate Limit 거부 여부 확인.
     *
     * @return Rate Limit 거부 여부
     */
    default boolean isRateLimited() {
        return this instanceof RateLimited;
    }

    /**
     * Circuit OPEN 거부 여부 확인.
     *
     * @return Circuit OPEN 거부 여부
     */
    default boolean isCircuitOpen() {
        return this instanceof CircuitOpen;
    }
}
