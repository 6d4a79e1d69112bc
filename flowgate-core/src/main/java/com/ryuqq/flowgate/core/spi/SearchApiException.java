package com.ryuqq.flowgate.core.spi;

/**
 * 외부 레지스트리 API 오류 (Rate Limit 이외).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SearchApiException extends CandidateSearchException {

    private final int statusCode;

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param statusCode 응답 상태 코드 (응답이 없으면 0)
     */
    public SearchApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param message 오류 메시지
     * @param statusCode 응답 상태 코드 (응답이 없으면 0)
     * @param cause 원인
     */
    public SearchApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
