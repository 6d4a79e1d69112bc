package com.ryuqq.flowgate.core.spi;

import java.util.List;
import java.util.Optional;

/**
 * Key-Value Storage SPI.
 *
 * <p>Reconciliation Engine이 링크({@code links/<encoded entityIri>})와
 * 검증 작업({@code queue/<taskId>})을 JSON 문자열로 저장하는 데 사용하는 저장소 추상화입니다.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: 모든 메서드는 여러 스레드에서 안전하게 호출 가능해야 함</li>
 *   <li>Read-your-writes: put 직후 get은 방금 쓴 값을 반환해야 함</li>
 *   <li>세대: 키에 대한 모든 쓰기는 세대를 1씩 증가시킴 (키 없음 = 0)</li>
 *   <li>조건부 쓰기: 세대 비교와 쓰기는 하나의 원자적 연산</li>
 *   <li>실패는 {@link StorageException}으로 보고</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface KeyValueStore {

    /**
     * 값 조회.
     *
     * @param key 키
     * @return 값 (없으면 empty)
     * @throws IllegalArgumentException key가 null이거나 빈 문자열인 경우
     * @throws StorageException 저장소 접근 실패 시
     */
    Optional<String> get(String key);

    /**
     * 값 저장 (기존 값 덮어쓰기).
     *
     * @param key 키
     * @param value 값
     * @throws IllegalArgumentException key 또는 value가 null인 경우
     * @throws StorageException 저장소 접근 실패 시
     */
    void put(String key, String value);

    /**
     * 세대 번호와 함께 값 조회.
     *
     * @param key 키
     * @return 값과 세대 (없으면 empty)
     * @throws IllegalArgumentException key가 null이거나 빈 문자열인 경우
     * @throws StorageException 저장소 접근 실패 시
     */
    Optional<VersionedValue> getVersioned(String key);

    /**
     * 세대가 일치할 때만 값 저장.
     *
     * <p>{@code expectedGeneration}이 0이면 키가 없을 때만 저장합니다.</p>
     *
     * @param key 키
     * @param value 값
     * @param expectedGeneration {@link #getVersioned(String)}로 읽은 세대 (신규 키는 0)
     * @return 저장 후 세대
     * @throws IllegalArgumentException key 또는 value가 null이거나 expectedGeneration이 음수인 경우
     * @throws GenerationMismatchException 현재 세대가 기대값과 다른 경우
     * @throws StorageException 저장소 접근 실패 시
     */
    long putIfGeneration(String key, String value, long expectedGeneration);

    /**
     * prefix로 시작하는 키 목록 조회.
     *
     * @param prefix 키 prefix (빈 문자열이면 전체)
     * @return 키 목록 (사전순 오름차순, 없으면 빈 목록)
     * @throws IllegalArgumentException prefix가 null인 경우
     * @throws StorageException 저장소 접근 실패 시
     */
    List<String> list(String prefix);
}
