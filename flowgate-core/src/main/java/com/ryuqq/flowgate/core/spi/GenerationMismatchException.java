package com.ryuqq.flowgate.core.spi;

/**
 * 조건부 쓰기의 세대 불일치.
 *
 * <p>{@link KeyValueStore#putIfGeneration(String, String, long)} 호출 시점의 세대가 기대값과 다르면 던집니다.
 * 읽은 뒤 다른 쓰기가 먼저 반영되었다는 뜻이며, 값은 변경되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class GenerationMismatchException extends StorageException {

    private final long expectedGeneration;
    private final long currentGeneration;

    /**
     * 생성자.
     *
     * @param key 대상 키
     * @param expectedGeneration 호출자가 기대한 세대 (0은 키 없음)
     * @param currentGeneration 실제 세대 (0은 키 없음)
     */
    public GenerationMismatchException(String key, long expectedGeneration, long currentGeneration) {
        super(key, "Generation mismatch for " + key
            + ": expected " + expectedGeneration + ", current " + currentGeneration);
        this.expectedGeneration = expectedGeneration;
        this.currentGeneration = currentGeneration;
    }

    public long getExpectedGeneration() {
        return expectedGeneration;
    }

    public long getCurrentGeneration() {
        return currentGeneration;
    }
}
