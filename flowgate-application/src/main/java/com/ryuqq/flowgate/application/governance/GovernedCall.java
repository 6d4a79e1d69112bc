package com.ryuqq.flowgate.application.governance;

import java.util.function.ToLongFunction;

/**
 * FlowGovernor 보호 하에 실행되는 호출.
 *
 * <p>실제 비용은 기본적으로 추정 비용과 같으며, 응답에서 실제 사용량(예: 토큰 수)을 알 수 있는 경우
 * {@link #actualCost(Object, long)}를 재정의하거나 {@link #of(GovernedCall, ToLongFunction)}를 사용합니다.</p>
 *
 * @param <T> 호출 결과 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface GovernedCall<T> {

    /**
     * 보호 대상 호출 실행.
     *
     * @return 호출 결과
     * @throws Exception 호출 실패 시 (실패로 기록됨)
     */
    T call() throws Exception;

    /**
     * 성공한 호출의 실제 비용.
     *
     * @param result 호출 결과
     * @param estimatedCost acquire 시 사용한 추정 비용
     * @return 실제 비용
     */
    default long actualCost(T result, long estimatedCost) {
        return estimatedCost;
    }

    /**
     * 결과에서 실제 비용을 계산하는 GovernedCall 생성.
     *
     * @param delegate 호출
     * @param costOf 결과 → 실제 비용 함수
     * @param <T> 결과 타입
     * @return GovernedCall
     */
    static <T> GovernedCall<T> of(GovernedCall<T> delegate, ToLongFunction<T> costOf) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (costOf == null) {
            throw new IllegalArgumentException("costOf cannot be null");
        }
        return new GovernedCall<>() {
            @Override
            public T call() throws Exception {
                return delegate.call();
            }

            @Override
            public long actualCost(T result, long estimatedCost) {
                return costOf.applyAsLong(result);
            }
        };
    }
}
