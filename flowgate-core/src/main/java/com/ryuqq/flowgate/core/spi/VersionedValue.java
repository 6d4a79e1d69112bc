package com.ryuqq.flowgate.core.spi;

/**
 * 세대(generation) 번호가 붙은 저장 값.
 *
 * <p>세대는 키에 값이 쓰일 때마다 증가합니다. {@link KeyValueStore#putIfGeneration(String, String, long)}에
 * 읽은 세대를 넘겨 낙관적 동시성 제어에 사용합니다.</p>
 *
 * @param value 저장된 값
 * @param generation 세대 번호 (1 이상)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record VersionedValue(String value, long generation) {

    /**
     * 값 검증.
     *
     * @throws IllegalArgumentException value가 null이거나 generation이 1 미만인 경우
     */
    public VersionedValue {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (generation < 1) {
            throw new IllegalArgumentException("generation must be positive (current: " + generation + ")");
        }
    }
}
