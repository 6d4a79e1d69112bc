package com.ryuqq.flowgate.core.admission;

/**
 * 승인됨.
 *
 * <p>동시 실행 슬롯이 할당되고 윈도우 카운터가 증가한 상태입니다.
 * 호출자는 모든 종료 경로에서 정확히 한 번 release를 호출해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Admitted() implements Admission {

    private static final Admitted INSTANCE = new Admitted();

    /**
     * 공유 인스턴스 조회.
     *
     * @return Admitted 인스턴스
     */
    public static Admitted instance() {
        return INSTANCE;
    }

    @Override
    public long retryAfterMs() {
        return 0;
    }
}
