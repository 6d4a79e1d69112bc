package com.ryuqq.flowgate.application.governance;

import com.ryuqq.flowgate.core.protection.FlowGovernor;

/**
 * 범위 기반(scoped) 보호 호출 실행기.
 *
 * <p>acquire와 release 짝을 하나의 호출 범위로 묶습니다. 승인된 호출은 정상 반환, 예외, 인터럽트 등
 * 어떤 경로로 끝나더라도 정확히 한 번 release 됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try {
 *     List&lt;Candidate&gt; candidates = invoker.invoke(1, () -&gt; client.search(label, options));
 * } catch (GovernanceRejectedException e) {
 *     // e.getRetryAfterMs() 이후 재시도
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface GovernedInvoker {

    /**
     * 보호 하에 호출 실행.
     *
     * <p><strong>종료 경로별 release:</strong></p>
     * <ul>
     *   <li>정상 반환: release(actualCost, true)</li>
     *   <li>예외 (InterruptedException 포함): release(estimatedCost, false) 후 예외 전파</li>
     *   <li>거부 (RateLimited, CircuitOpen): release 없음, {@link GovernanceRejectedException}</li>
     *   <li>슬롯 대기 중 인터럽트: release 없음, InterruptedException 전파</li>
     * </ul>
     *
     * @param estimatedCost 추정 비용 (0 이상)
     * @param call 보호 대상 호출
     * @param <T> 결과 타입
     * @return 호출 결과
     * @throws GovernanceRejectedException 승인되지 않은 경우
     * @throws InterruptedException 슬롯 대기 중 인터럽트된 경우
     * @throws Exception call이 던진 예외
     */
    <T> T invoke(long estimatedCost, GovernedCall<T> call) throws Exception;

    /**
     * 대상 FlowGovernor 조회.
     *
     * @return FlowGovernor
     */
    FlowGovernor governor();
}
