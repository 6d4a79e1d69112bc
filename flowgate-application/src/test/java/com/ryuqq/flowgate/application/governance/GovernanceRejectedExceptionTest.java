package com.ryuqq.flowgate.application.governance;

import com.ryuqq.flowgate.core.admission.Admitted;
import com.ryuqq.flowgate.core.admission.CircuitOpen;
import com.ryuqq.flowgate.core.admission.RateLimitReason;
import com.ryuqq.flowgate.core.admission.RateLimited;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * GovernanceRejectedException 및 GovernedCall 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("GovernanceRejectedException 테스트")
class GovernanceRejectedExceptionTest {

    @Test
    @DisplayName("거부 사유와 재시도 대기 시간을 전달한다")
    void 거부_사유_전달() {
        // given
        RateLimited rateLimited = new RateLimited(RateLimitReason.REQUESTS, 4_000);

        // when
        GovernanceRejectedException exception = new GovernanceRejectedException(rateLimited);

        // then
        assertThat(exception.getAdmission()).isEqualTo(rateLimited);
        assertThat(exception.getRetryAfterMs()).isEqualTo(4_000);
        assertThat(exception.getMessage()).contains("4000ms");
    }

    @Test
    @DisplayName("CircuitOpen 거부도 표현할 수 있다")
    void circuitOpen_거부() {
        GovernanceRejectedException exception = new GovernanceRejectedException(new CircuitOpen(10));

        assertThat(exception.getAdmission().isCircuitOpen()).isTrue();
    }

    @Test
    @DisplayName("승인 또는 null은 거부 사유가 될 수 없다")
    void 승인은_거부_사유_아님() {
        assertThatThrownBy(() -> new GovernanceRejectedException(Admitted.instance()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GovernanceRejectedException(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null");
    }

    @Test
    @DisplayName("GovernedCall의 기본 실제 비용은 추정 비용이다")
    void governedCall_기본_실제_비용() throws Exception {
        GovernedCall<String> call = () -> "result";

        assertThat(call.call()).isEqualTo("result");
        assertThat(call.actualCost("result", 42)).isEqualTo(42);
    }

    @Test
    @DisplayName("GovernedCall.of() 는 결과에서 실제 비용을 계산한다")
    void governedCall_결과_기반_비용() throws Exception {
        GovernedCall<String> call = GovernedCall.of(() -> "abcd", String::length);

        assertThat(call.actualCost(call.call(), 100)).isEqualTo(4);
    }
}
