package com.ryuqq.flowgate.core.spi;

/**
 * Key-Value 저장소 접근 실패.
 *
 * <p>{@link KeyValueStore} 구현체가 읽기/쓰기/목록 조회에 실패했을 때 던집니다.
 * 상위 서비스는 이 예외를 문맥 정보와 함께 자신의 오류 타입으로 감쌉니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StorageException extends RuntimeException {

    private final String key;

    /**
     * 생성자.
     *
     * @param key 실패한 키 또는 prefix
     * @param message 오류 메시지
     */
    public StorageException(String key, String message) {
        super(message);
        this.key = key;
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param key 실패한 키 또는 prefix
     * @param message 오류 메시지
     * @param cause 원인
     */
    public StorageException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /**
     * 실패한 키 조회.
     *
     * @return 키 또는 prefix (null 가능)
     */
    public String getKey() {
        return key;
    }
}
