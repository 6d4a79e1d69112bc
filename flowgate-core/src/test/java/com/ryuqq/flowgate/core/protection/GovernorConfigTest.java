package com.ryuqq.flowgate.core.protection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GovernorConfig 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("GovernorConfig 테스트")
class GovernorConfigTest {

    @Test
    @DisplayName("기본 생성자는 기본값을 사용한다")
    void 기본값() {
        // when
        GovernorConfig config = new GovernorConfig();

        // then
        assertEquals(50, config.requestsPerWindow());
        assertEquals(100_000, config.tokensPerWindow());
        assertEquals(60_000, config.windowDurationMs());
        assertEquals(5, config.maxConcurrent());
        assertEquals(5, config.failureThreshold());
        assertEquals(120_000, config.recoveryTimeoutMs());
        assertEquals(2, config.successThreshold());
    }

    @Test
    @DisplayName("처리량 생성자는 나머지를 기본값으로 채운다")
    void 처리량_생성자() {
        // when
        GovernorConfig config = new GovernorConfig(10, 500, 3);

        // then
        assertEquals(10, config.requestsPerWindow());
        assertEquals(500, config.tokensPerWindow());
        assertEquals(3, config.maxConcurrent());
        assertEquals(GovernorConfig.DEFAULT_WINDOW_DURATION_MS, config.windowDurationMs());
        assertEquals(GovernorConfig.DEFAULT_FAILURE_THRESHOLD, config.failureThreshold());
    }

    @Test
    @DisplayName("0 이하 값은 거부된다")
    void 양수_검증() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> new GovernorConfig().withRequestsPerWindow(0));
        assertEquals("requestsPerWindow must be positive (current: 0)", exception.getMessage());

        assertThrows(IllegalArgumentException.class, () -> new GovernorConfig().withMaxConcurrent(-1));
        assertThrows(IllegalArgumentException.class, () -> new GovernorConfig().withRecoveryTimeoutMs(0));
    }

    @Test
    @DisplayName("withXxx() 는 해당 필드만 바꾼 새 인스턴스를 반환한다")
    void with_복사() {
        // given
        GovernorConfig base = new GovernorConfig();

        // when
        GovernorConfig changed = base.withFailureThreshold(3).withSuccessThreshold(1);

        // then
        assertEquals(3, changed.failureThreshold());
        assertEquals(1, changed.successThreshold());
        assertEquals(base.requestsPerWindow(), changed.requestsPerWindow());
        assertEquals(5, base.failureThreshold());
    }
}
