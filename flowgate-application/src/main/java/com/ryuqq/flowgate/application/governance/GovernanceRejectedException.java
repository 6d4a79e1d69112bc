package com.ryuqq.flowgate.application.governance;

import com.ryuqq.flowgate.core.admission.Admission;

/**
 * FlowGovernor가 호출을 승인하지 않은 경우.
 *
 * <p>항상 재시도 가능한 일시적 거부이며, {@link #getRetryAfterMs()} 이후 재시도를 권장합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class GovernanceRejectedException extends RuntimeException {

    private final Admission admission;

    /**
     * 생성자.
     *
     * @param admission 거부 사유 (RateLimited 또는 CircuitOpen)
     * @throws IllegalArgumentException admission이 null이거나 승인인 경우
     */
    public GovernanceRejectedException(Admission admission) {
        super(describe(admission));
        this.admission = admission;
    }

    private static String describe(Admission admission) {
        if (admission == null) {
            throw new IllegalArgumentException("admission cannot be null");
        }
        if (admission.isAdmitted()) {
            throw new IllegalArgumentException("admission must be a rejection (current: " + admission + ")");
        }
        return "Call rejected by flow governor: " + admission + " (retry after " + admission.retryAfterMs() + "ms)";
    }

    public Admission getAdmission() {
        return admission;
    }

    public long getRetryAfterMs() {
        return admission.retryAfterMs();
    }
}
