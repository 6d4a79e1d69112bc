package com.ryuqq.flowgate.adapter.runner;

import com.ryuqq.flowgate.core.admission.Admission;
import com.ryuqq.flowgate.core.admission.Admitted;
import com.ryuqq.flowgate.core.admission.CircuitOpen;
import com.ryuqq.flowgate.core.admission.RateLimitReason;
import com.ryuqq.flowgate.core.admission.RateLimited;
import com.ryuqq.flowgate.core.protection.CircuitBreakerState;
import com.ryuqq.flowgate.core.protection.GovernorConfig;
import com.ryuqq.flowgate.core.protection.GovernorSnapshot;
import com.ryuqq.flowgate.testkit.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LocalFlowGovernor 구현체 고유 동작 테스트.
 *
 * <p>공통 계약은 {@link LocalFlowGovernorContractTest}에서 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("LocalFlowGovernor 테스트")
class LocalFlowGovernorTest {

    private ManualClock clock;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
    }

    @Test
    @DisplayName("null 의존성과 음수 비용은 거부된다")
    void 입력_검증() {
        assertThatThrownBy(() -> new LocalFlowGovernor(null, clock))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("config cannot be null");
        assertThatThrownBy(() -> new LocalFlowGovernor(new GovernorConfig(), null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LocalFlowGovernor(new GovernorConfig(), clock).acquire(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LocalFlowGovernor(new GovernorConfig(), clock).forceCircuitState(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("토큰 한도를 넘는 거대한 비용은 overflow 없이 TOKENS로 거부된다")
    void 거대_비용_토큰_거부() throws InterruptedException {
        // given
        LocalFlowGovernor governor = new LocalFlowGovernor(new GovernorConfig(50, 1_000, 5), clock);
        assertThat(governor.acquire(1)).isInstanceOf(Admitted.class);

        // when
        Admission huge = governor.acquire(Long.MAX_VALUE);

        // then
        assertThat(huge).isInstanceOf(RateLimited.class);
        assertThat(((RateLimited) huge).reason()).isEqualTo(RateLimitReason.TOKENS);
        assertThat(governor.metrics().tokensInWindow()).isEqualTo(1);
        assertThat(governor.acquire(999)).isInstanceOf(Admitted.class);
        assertThat(governor.acquire(1)).isInstanceOf(RateLimited.class);
        assertThat(governor.metrics().tokensInWindow()).isEqualTo(1_000);
    }

    @Test
    @DisplayName("짝이 없는 release는 무시되고 예외를 던지지 않는다")
    void 짝없는_release_무시() {
        // given
        LocalFlowGovernor governor = new LocalFlowGovernor(new GovernorConfig(), clock);

        // when
        governor.release(10, false);

        // then
        GovernorSnapshot snapshot = governor.metrics();
        assertThat(snapshot.inFlight()).isZero();
        assertThat(snapshot.consecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("OPEN 상태에서 도착한 이전 호출의 실패는 복구 시점을 늦추지 않는다")
    void OPEN_중_실패는_복구시점_유지() throws InterruptedException {
        // given
        GovernorConfig config = new GovernorConfig().withFailureThreshold(1);
        LocalFlowGovernor governor = new LocalFlowGovernor(config, clock);
        long openedAt = clock.currentTimeMillis();
        governor.acquire(1);
        governor.acquire(1);
        governor.release(1, false);

        // when
        clock.advance(10_000);
        governor.release(1, false);
        Admission admission = governor.acquire(1);

        // then
        assertThat(governor.metrics().circuitOpenedAt()).isEqualTo(openedAt);
        assertThat(admission).isInstanceOf(CircuitOpen.class);
        assertThat(admission.retryAfterMs()).isEqualTo(config.recoveryTimeoutMs() - 10_000);
    }

    @Test
    @DisplayName("HALF_OPEN 전이 시 이전 연속 성공 수는 초기화된다")
    void HALF_OPEN_전이시_성공수_초기화() throws InterruptedException {
        // given
        GovernorConfig config = new GovernorConfig().withFailureThreshold(1);
        LocalFlowGovernor governor = new LocalFlowGovernor(config, clock);
        governor.acquire(1);
        governor.acquire(1);
        governor.release(1, false);
        governor.release(1, true);

        // when
        clock.advance(config.recoveryTimeoutMs());
        governor.acquire(1);
        governor.release(1, true);

        // then
        assertThat(governor.metrics().circuitState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(governor.metrics().consecutiveSuccesses()).isEqualTo(1);
    }

    @Test
    @DisplayName("슬롯 대기 중 인터럽트되면 예약이 취소되고 InterruptedException이 전파된다")
    void 슬롯_대기중_인터럽트() throws InterruptedException {
        // given
        GovernorConfig config = new GovernorConfig(10, 1_000, 1);
        LocalFlowGovernor governor = new LocalFlowGovernor(config, clock);
        assertThat(governor.acquire(5).isAdmitted()).isTrue();

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread waiter = new Thread(() -> {
            try {
                governor.acquire(10);
            } catch (InterruptedException e) {
                failure.set(e);
            }
        });

        // when
        waiter.start();
        awaitReservedRequests(governor, 2);
        waiter.interrupt();
        waiter.join(5_000);

        // then
        assertThat(failure.get()).isInstanceOf(InterruptedException.class);
        GovernorSnapshot snapshot = governor.metrics();
        assertThat(snapshot.requestsInWindow()).isEqualTo(1);
        assertThat(snapshot.tokensInWindow()).isEqualTo(5);
        assertThat(snapshot.inFlight()).isEqualTo(1);
    }

    private static void awaitReservedRequests(LocalFlowGovernor governor, int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (governor.metrics().requestsInWindow() < expected) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("waiter did not reserve within 5s");
            }
            Thread.sleep(5);
        }
    }
}
