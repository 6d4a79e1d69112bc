package com.ryuqq.flowgate.adapter.runner;

import com.ryuqq.flowgate.core.admission.Admission;
import com.ryuqq.flowgate.core.admission.Admitted;
import com.ryuqq.flowgate.core.admission.CircuitOpen;
import com.ryuqq.flowgate.core.admission.RateLimitReason;
import com.ryuqq.flowgate.core.admission.RateLimited;
import com.ryuqq.flowgate.core.protection.CircuitBreakerState;
import com.ryuqq.flowgate.core.protection.FlowGovernor;
import com.ryuqq.flowgate.core.protection.GovernorConfig;
import com.ryuqq.flowgate.core.protection.GovernorSnapshot;
import com.ryuqq.flowgate.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 프로세스 로컬 FlowGovernor 구현체.
 *
 * <p>고정 윈도우 Rate Limiter, Circuit Breaker, 동시 실행 Bulkhead를 하나의 상태로 결합합니다.
 * 모든 상태는 단일 {@link ReentrantLock}으로 보호되며, 슬롯 대기({@link Semaphore})만 락 밖에서 수행됩니다.</p>
 *
 * <p><strong>acquire 처리 흐름:</strong></p>
 * <pre>
 * [lock]
 *   1. OPEN이고 recoveryTimeout 미경과 → CircuitOpen
 *      OPEN이고 recoveryTimeout 경과   → HALF_OPEN 전이
 *   2. 윈도우 경과 → 카운터 초기화
 *   3. 요청 수 초과 → RateLimited(REQUESTS)
 *   4. 토큰 수 초과 → RateLimited(TOKENS)
 *   5. 요청/토큰 예약
 * [unlock]
 *   6. 슬롯 대기 (인터럽트 시 예약 취소)
 * </pre>
 *
 * <p>요청/토큰은 슬롯 대기 전에 예약됩니다. 대기 중 인터럽트되면 같은 윈도우인 경우에 한해 예약을 되돌립니다.</p>
 *
 * <p><strong>release 처리:</strong></p>
 * <ul>
 *   <li>성공: 연속 성공 +1, 연속 실패 0. HALF_OPEN에서 successThreshold 도달 시 CLOSED</li>
 *   <li>실패: 연속 실패 +1, 연속 성공 0. CLOSED에서 failureThreshold 도달 시, 또는 HALF_OPEN에서 즉시 OPEN</li>
 * </ul>
 *
 * <p>클러스터 전역 제한은 지원하지 않습니다. 인스턴스는 프로세스당 하나를 공유해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LocalFlowGovernor implements FlowGovernor {

    private static final Logger log = LoggerFactory.getLogger(LocalFlowGovernor.class);

    private final GovernorConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Semaphore slots;

    // 이하 필드는 lock으로 보호
    private int requestsInWindow;
    private long tokensInWindow;
    private long windowStart;
    private CircuitBreakerState circuitState = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private long circuitOpenedAt;
    private int inFlight;

    /**
     * 시스템 시계를 사용하는 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public LocalFlowGovernor(GovernorConfig config) {
        this(config, Clock.system());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public LocalFlowGovernor(GovernorConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.slots = new Semaphore(config.maxConcurrent());
        this.windowStart = clock.currentTimeMillis();
    }

    @Override
    public Admission acquire(long estimatedCost) throws InterruptedException {
        if (estimatedCost < 0) {
            throw new IllegalArgumentException("estimatedCost must be non-negative (current: " + estimatedCost + ")");
        }

        long reservedWindow;
        lock.lock();
        try {
            long now = clock.currentTimeMillis();

            // 1. Circuit Breaker
            if (circuitState == CircuitBreakerState.OPEN) {
                long elapsed = now - circuitOpenedAt;
                if (elapsed < config.recoveryTimeoutMs()) {
                    long retryAfterMs = config.recoveryTimeoutMs() - elapsed;
                    log.debug("Acquire rejected: circuit OPEN (retryAfter={}ms)", retryAfterMs);
                    return new CircuitOpen(retryAfterMs);
                }
                consecutiveSuccesses = 0;
                transitionTo(CircuitBreakerState.HALF_OPEN, now);
            }

            // 2. 고정 윈도우 초기화
            if (now - windowStart > config.windowDurationMs()) {
                requestsInWindow = 0;
                tokensInWindow = 0;
                windowStart = now;
            }

            // 3-4. Rate Limit
            long retryAfterMs = remainingWindow(now);
            if (requestsInWindow >= config.requestsPerWindow()) {
                log.debug("Acquire rejected: request limit {} reached (retryAfter={}ms)",
                    config.requestsPerWindow(), retryAfterMs);
                return new RateLimited(RateLimitReason.REQUESTS, retryAfterMs);
            }
            // tokensInWindow <= tokensPerWindow 이므로 뺄셈은 overflow 없음
            if (estimatedCost > config.tokensPerWindow() - tokensInWindow) {
                log.debug("Acquire rejected: token limit {} exceeded by cost {} (retryAfter={}ms)",
                    config.tokensPerWindow(), estimatedCost, retryAfterMs);
                return new RateLimited(RateLimitReason.TOKENS, retryAfterMs);
            }

            // 5. 예약
            requestsInWindow++;
            tokensInWindow += estimatedCost;
            reservedWindow = windowStart;
        } finally {
            lock.unlock();
        }

        // 6. 슬롯 대기 (유일한 블로킹 지점)
        try {
            slots.acquire();
        } catch (InterruptedException e) {
            cancelReservation(reservedWindow, estimatedCost);
            throw e;
        }

        lock.lock();
        try {
            inFlight++;
            log.debug("Acquire admitted: cost={}, inFlight={}", estimatedCost, inFlight);
        } finally {
            lock.unlock();
        }
        return Admitted.instance();
    }

    private void cancelReservation(long reservedWindow, long estimatedCost) {
        lock.lock();
        try {
            if (windowStart == reservedWindow) {
                requestsInWindow = Math.max(0, requestsInWindow - 1);
                tokensInWindow = Math.max(0, tokensInWindow - estimatedCost);
            }
            log.debug("Acquire interrupted while waiting for slot, reservation cancelled");
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release(long actualCost, boolean success) {
        lock.lock();
        try {
            if (inFlight == 0) {
                log.warn("release() called without a matching admitted acquire, ignored");
                return;
            }
            inFlight--;

            long now = clock.currentTimeMillis();
            if (success) {
                recordSuccess(now);
            } else {
                recordFailure(now);
            }
            log.debug("Released: actualCost={}, success={}, inFlight={}", actualCost, success, inFlight);
        } finally {
            lock.unlock();
        }
        slots.release();
    }

    private void recordSuccess(long now) {
        consecutiveSuccesses++;
        consecutiveFailures = 0;
        if (circuitState == CircuitBreakerState.HALF_OPEN && consecutiveSuccesses >= config.successThreshold()) {
            transitionTo(CircuitBreakerState.CLOSED, now);
        }
    }

    private void recordFailure(long now) {
        consecutiveFailures++;
        consecutiveSuccesses = 0;
        boolean probeFailed = circuitState == CircuitBreakerState.HALF_OPEN;
        boolean thresholdReached = circuitState == CircuitBreakerState.CLOSED
            && consecutiveFailures >= config.failureThreshold();
        if (probeFailed || thresholdReached) {
            circuitOpenedAt = now;
            transitionTo(CircuitBreakerState.OPEN, now);
        }
    }

    private void transitionTo(CircuitBreakerState next, long now) {
        CircuitBreakerState previous = circuitState;
        circuitState = next;
        if (next == CircuitBreakerState.OPEN) {
            log.warn("Circuit {} → OPEN after {} consecutive failures (recovery in {}ms)",
                previous, consecutiveFailures, config.recoveryTimeoutMs());
        } else {
            log.info("Circuit {} → {} at {}", previous, next, now);
        }
    }

    private long remainingWindow(long now) {
        return Math.max(0, config.windowDurationMs() - (now - windowStart));
    }

    @Override
    public GovernorSnapshot metrics() {
        lock.lock();
        try {
            return new GovernorSnapshot(
                requestsInWindow,
                tokensInWindow,
                windowStart,
                circuitState,
                consecutiveFailures,
                consecutiveSuccesses,
                circuitOpenedAt,
                inFlight
            );
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long resetTime() {
        lock.lock();
        try {
            return remainingWindow(clock.currentTimeMillis());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void forceCircuitState(CircuitBreakerState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        lock.lock();
        try {
            long now = clock.currentTimeMillis();
            switch (state) {
                case OPEN -> circuitOpenedAt = now;
                case CLOSED -> {
                    consecutiveFailures = 0;
                    consecutiveSuccesses = 0;
                }
                case HALF_OPEN -> consecutiveSuccesses = 0;
            }
            log.info("Circuit state forced: {} → {}", circuitState, state);
            circuitState = state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public GovernorConfig getConfig() {
        return config;
    }
}
