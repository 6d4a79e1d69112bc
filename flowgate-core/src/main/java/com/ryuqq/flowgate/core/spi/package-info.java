/**
 * 외부 협력자 SPI 패키지.
 *
 * <p>코어가 소비하는 외부 협력자의 좁은 계약을 정의합니다:</p>
 * <ul>
 *   <li>{@link com.ryuqq.flowgate.core.spi.Clock}: 시각</li>
 *   <li>{@link com.ryuqq.flowgate.core.spi.KeyValueStore}: 링크/작업 영속화</li>
 *   <li>{@link com.ryuqq.flowgate.core.spi.CandidateSearchClient}: 외부 레지스트리 후보 검색</li>
 * </ul>
 *
 * <p>구체적인 저장소 백엔드와 HTTP 전송은 이 프로젝트 범위 밖이며,
 * 참조 구현은 {@code flowgate-adapter-inmemory} 모듈에 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flowgate.core.spi;
