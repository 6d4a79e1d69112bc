package com.ryuqq.flowgate.core.spi;

/**
 * 외부 레지스트리 검색 실패.
 *
 * <p>이 코어는 검색 실패를 감싸거나 재해석하지 않고 그대로 전파합니다.
 * 호출자는 "우리 쪽 기록 실패"({@code ReconciliationException})와 "레지스트리 실패"를 타입으로 구분할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract sealed class CandidateSearchException extends RuntimeException
    permits SearchRateLimitedException, SearchApiException {

    protected CandidateSearchException(String message) {
        super(message);
    }

    protected CandidateSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
