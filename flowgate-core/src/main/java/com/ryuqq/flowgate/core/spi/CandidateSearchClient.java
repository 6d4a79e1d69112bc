package com.ryuqq.flowgate.core.spi;

import com.ryuqq.flowgate.core.reconciliation.Candidate;

import java.util.List;

/**
 * 후보 검색 클라이언트 SPI.
 *
 * <p>외부 레지스트리(지식 베이스)에서 레이블로 엔티티 후보를 검색합니다.
 * 후보의 내부 랭킹 방식은 이 SPI의 관심사가 아닙니다.</p>
 *
 * <p><strong>반환 계약:</strong></p>
 * <ul>
 *   <li>점수 내림차순 정렬 (첫 번째 요소가 최선의 후보)</li>
 *   <li>결과 없음은 빈 목록 (null 불가)</li>
 * </ul>
 *
 * <p><strong>실패 계약:</strong> 레지스트리 자체의 Rate Limit은 {@link SearchRateLimitedException},
 * 그 외 API 오류는 {@link SearchApiException}으로 구분하여 보고합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CandidateSearchClient {

    /**
     * 레이블로 후보 검색.
     *
     * @param label 검색할 레이블
     * @param options 언어 및 최대 후보 수
     * @return 점수 내림차순 후보 목록
     * @throws CandidateSearchException 외부 레지스트리 오류 시
     */
    List<Candidate> search(String label, SearchOptions options);
}
