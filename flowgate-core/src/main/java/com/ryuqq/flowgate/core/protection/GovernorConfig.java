package com.ryuqq.flowgate.core.protection;

/**
 * Flow Governor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>requestsPerWindow: 윈도우당 최대 요청 수 (기본 50)</li>
 *   <li>tokensPerWindow: 윈도우당 최대 토큰 수 (기본 100000)</li>
 *   <li>windowDurationMs: 고정 윈도우 길이 (기본 60000ms)</li>
 *   <li>maxConcurrent: 최대 동시 실행 수 (기본 5)</li>
 *   <li>failureThreshold: Circuit OPEN까지의 연속 실패 수 (기본 5)</li>
 *   <li>recoveryTimeoutMs: OPEN 유지 시간 (기본 120000ms)</li>
 *   <li>successThreshold: HALF_OPEN → CLOSED 연속 성공 수 (기본 2)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param requestsPerWindow 윈도우당 최대 요청 수 (양수)
 * @param tokensPerWindow 윈도우당 최대 토큰 수 (양수)
 * @param windowDurationMs 윈도우 길이 (밀리초, 양수)
 * @param maxConcurrent 최대 동시 실행 수 (양수)
 * @param failureThreshold 연속 실패 임계값 (양수)
 * @param recoveryTimeoutMs 복구 대기 시간 (밀리초, 양수)
 * @param successThreshold 연속 성공 임계값 (양수)
 */
public record GovernorConfig(
    int requestsPerWindow,
    long tokensPerWindow,
    long windowDurationMs,
    int maxConcurrent,
    int failureThreshold,
    long recoveryTimeoutMs,
    int successThreshold
) {

    public static final long DEFAULT_WINDOW_DURATION_MS = 60_000;
    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final long DEFAULT_RECOVERY_TIMEOUT_MS = 120_000;
    public static final int DEFAULT_SUCCESS_THRESHOLD = 2;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: requestsPerWindow=50, tokensPerWindow=100000, windowDurationMs=60000,
     * maxConcurrent=5, failureThreshold=5, recoveryTimeoutMs=120000, successThreshold=2</p>
     */
    public GovernorConfig() {
        this(50, 100_000, DEFAULT_WINDOW_DURATION_MS, 5,
            DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIMEOUT_MS, DEFAULT_SUCCESS_THRESHOLD);
    }

    /**
     * 처리량 제한만 지정하고 나머지는 기본값을 사용하는 생성자.
     *
     * @param requestsPerWindow 윈도우당 최대 요청 수
     * @param tokensPerWindow 윈도우당 최대 토큰 수
     * @param maxConcurrent 최대 동시 실행 수
     */
    public GovernorConfig(int requestsPerWindow, long tokensPerWindow, int maxConcurrent) {
        this(requestsPerWindow, tokensPerWindow, DEFAULT_WINDOW_DURATION_MS, maxConcurrent,
            DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIMEOUT_MS, DEFAULT_SUCCESS_THRESHOLD);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public GovernorConfig {
        requirePositive("requestsPerWindow", requestsPerWindow);
        requirePositive("tokensPerWindow", tokensPerWindow);
        requirePositive("windowDurationMs", windowDurationMs);
        requirePositive("maxConcurrent", maxConcurrent);
        requirePositive("failureThreshold", failureThreshold);
        requirePositive("recoveryTimeoutMs", recoveryTimeoutMs);
        requirePositive("successThreshold", successThreshold);
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }

    public GovernorConfig withRequestsPerWindow(int requestsPerWindow) {
        return new GovernorConfig(requestsPerWindow, tokensPerWindow, windowDurationMs, maxConcurrent,
            failureThreshold, recoveryTimeoutMs, successThreshold);
    }

    public GovernorConfig withTokensPerWindow(long tokensPerWindow) {
        return new GovernorConfig(requestsPerWindow, tokensPerWindow, windowDurationMs, maxConcurrent,
            failureThreshold, recoveryTimeoutMs, successThreshold);
    }

    public GovernorConfig withWindowDurationMs(long windowDurationMs) {
        return new GovernorConfig(requestsPerWindow, tokensPerWindow, windowDurationMs, maxConcurrent,
            failureThreshold, recoveryTimeoutMs, successThreshold);
    }

    public GovernorConfig withMaxConcurrent(int maxConcurrent) {
        return new GovernorConfig(requestsPerWindow, tokensPerWindow, windowDurationMs, maxConcurrent,
            failureThreshold, recoveryTimeoutMs, successThreshold);
    }

    public GovernorConfig withFailureThreshold(int failureThreshold) {
        return new GovernorConfig(requestsPerWindow, tokensPerWindow, windowDurationMs, maxConcurrent,
            failureThreshold, recoveryTimeoutMs, successThreshold);
    }

    public GovernorConfig withRecoveryTimeoutMs(long recoveryTimeoutMs) {
        return new GovernorConfig(requestsPerWindow, tokensPerWindow, windowDurationMs, maxConcurrent,
            failureThreshold, recoveryTimeoutMs, successThreshold);
    }

    public GovernorConfig withSuccessThreshold(int successThreshold) {
        return new GovernorConfig(requestsPerWindow, tokensPerWindow, windowDurationMs, maxConcurrent,
            failureThreshold, recoveryTimeoutMs, successThreshold);
    }
}
