package com.ryuqq.flowgate.core.protection;

import com.ryuqq.flowgate.core.admission.Admission;

/**
 * Flow Governor SPI.
 *
 * <p>비싸고 Rate Limit이 있으며 간헐적으로 실패하는 외부 의존성(LLM Provider 등)에 대한 호출을
 * 처리량 제한, 동시 실행 제한, 최근 실패 이력에 따라 승인하거나 거부합니다.</p>
 *
 * <p><strong>Protection 체인 순서 (acquire):</strong></p>
 * <pre>
 * 1. CircuitBreaker  → OPEN 상태면 즉시 CircuitOpen
 * 2. Window Reset    → 윈도우 경과 시 카운터 초기화 (고정 윈도우)
 * 3. RateLimiter     → 요청 수 / 토큰 수 초과 시 즉시 RateLimited
 * 4. 예약            → 요청 수 / 토큰 수를 윈도우에 선반영
 * 5. Bulkhead        → 동시 실행 슬롯 대기 (유일한 블로킹 지점, 인터럽트 시 4의 예약 취소)
 * </pre>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Admission admission = governor.acquire(estimatedTokens);
 * if (!admission.isAdmitted()) {
 *     return retryLater(admission.retryAfterMs());
 * }
 *
 * boolean success = false;
 * long actual = estimatedTokens;
 * try {
 *     Response response = llm.call(prompt);
 *     actual = response.usage().totalTokens();
 *     success = true;
 *     return response;
 * } finally {
 *     governor.release(actual, success);
 * }
 * }</pre>
 *
 * <p>try-finally를 직접 작성하는 대신 {@code GovernedInvoker}를 사용하는 것을 권장합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>모든 상태 읽기/쓰기는 단일 상호 배제 지점에서 수행</li>
 *   <li>Rate/Circuit 거부 시 절대 대기하지 않음 (retryAfterMs 힌트 반환)</li>
 *   <li>내부 sleep/backoff 없음 (backoff는 호출자 책임)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface FlowGovernor {

    /**
     * 호출 승인 요청.
     *
     * <p>Rate Limit 또는 Circuit OPEN으로 거부되는 경우 대기하지 않고 즉시 반환합니다.
     * 동시 실행 슬롯이 모두 사용 중이면 슬롯이 반환될 때까지 대기합니다.</p>
     *
     * @param estimatedCost 예상 토큰 비용 (0 이상)
     * @return Admitted, RateLimited, CircuitOpen 중 하나
     * @throws InterruptedException 슬롯 대기 중 인터럽트 발생 (이 경우 승인되지 않았으므로 release 불필요)
     * @throws IllegalArgumentException estimatedCost가 음수인 경우
     */
    Admission acquire(long estimatedCost) throws InterruptedException;

    /**
     * 호출 완료 보고 및 슬롯 반환.
     *
     * <p>{@link com.ryuqq.flowgate.core.admission.Admitted}를 받은 모든 호출에 대해 모든 종료 경로에서 정확히 한 번 호출되어야 합니다.
     * 호출하지 않으면 동시 실행 슬롯이 영구적으로 누수됩니다. 예외를 던지지 않습니다.</p>
     *
     * @param actualCost 실제 토큰 비용
     * @param success 호출 성공 여부
     */
    void release(long actualCost, boolean success);

    /**
     * 현재 상태 스냅샷 조회.
     *
     * @return 상태 스냅샷
     */
    GovernorSnapshot metrics();

    /**
     * 현재 윈도우가 끝날 때까지 남은 시간.
     *
     * @return 남은 시간 (밀리초, 0 이상)
     */
    long resetTime();

    /**
     * Circuit Breaker 상태 강제 변경.
     *
     * <p>운영 중 수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     *
     * @param state 새 상태
     * @throws IllegalArgumentException state가 null인 경우
     */
    void forceCircuitState(CircuitBreakerState state);

    /**
     * 설정 정보 조회.
     *
     * @return Governor 설정
     */
    GovernorConfig getConfig();
}
