package com.ryuqq.flowgate.adapter.runner;

import com.ryuqq.flowgate.application.governance.GovernanceRejectedException;
import com.ryuqq.flowgate.application.governance.GovernedCall;
import com.ryuqq.flowgate.application.governance.GovernedInvoker;
import com.ryuqq.flowgate.core.admission.Admission;
import com.ryuqq.flowgate.core.protection.FlowGovernor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * try/finally 기반 {@link GovernedInvoker} 구현체.
 *
 * <p>승인된 호출은 어떤 경로로 종료되더라도 finally 블록에서 정확히 한 번 release 됩니다.
 * 실제 비용 계산이 실패하면 추정 비용으로 대체합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScopedGovernedInvoker implements GovernedInvoker {

    private static final Logger log = LoggerFactory.getLogger(ScopedGovernedInvoker.class);

    private final FlowGovernor governor;

    /**
     * 생성자.
     *
     * @param governor 대상 FlowGovernor
     * @throws IllegalArgumentException governor가 null인 경우
     */
    public ScopedGovernedInvoker(FlowGovernor governor) {
        if (governor == null) {
            throw new IllegalArgumentException("governor cannot be null");
        }
        this.governor = governor;
    }

    @Override
    public <T> T invoke(long estimatedCost, GovernedCall<T> call) throws Exception {
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }

        // 슬롯 대기 중 인터럽트는 승인 전이므로 release 없이 전파
        Admission admission = governor.acquire(estimatedCost);
        if (!admission.isAdmitted()) {
            throw new GovernanceRejectedException(admission);
        }

        boolean success = false;
        long actualCost = estimatedCost;
        try {
            T result = call.call();
            actualCost = resolveActualCost(call, result, estimatedCost);
            success = true;
            return result;
        } finally {
            governor.release(actualCost, success);
        }
    }

    private <T> long resolveActualCost(GovernedCall<T> call, T result, long estimatedCost) {
        try {
            return call.actualCost(result, estimatedCost);
        } catch (RuntimeException e) {
            log.warn("Failed to compute actual cost, falling back to estimate {}", estimatedCost, e);
            return estimatedCost;
        }
    }

    @Override
    public FlowGovernor governor() {
        return governor;
    }
}
