package com.ryuqq.flowgate.core.model;

import java.util.regex.Pattern;

/**
 * 멱등성 키 (Idempotency Key).
 *
 * <p>논리적으로 동일한 작업 단위를 식별하는 64자리 소문자 16진수 문자열(SHA-256 digest)입니다.
 * 캐시 키, 작업 큐 키, 저장소 경로 세그먼트로 동일하게 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 불가</li>
 *   <li>정확히 64자, [0-9a-f]만 허용</li>
 * </ul>
 *
 * <p>동등성(equals)만이 의미 있는 연산입니다. {@link #shortForm()}은 로그/화면 표시용이며
 * 동등성 비교에 사용해서는 안 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class IdempotencyKey {

    /**
     * 키 길이 (SHA-256 hex).
     */
    public static final int LENGTH = 64;

    private static final int SHORT_FORM_LENGTH = 12;
    private static final Pattern HEX_64 = Pattern.compile("^[0-9a-f]{64}$");

    private final String value;

    private IdempotencyKey(String value) {
        if (value == null) {
            throw new IllegalArgumentException("IdempotencyKey cannot be null");
        }
        if (!HEX_64.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "IdempotencyKey must be 64 lowercase hex characters (current: " + value + ")"
            );
        }
        this.value = value;
    }

    /**
     * IdempotencyKey 생성.
     *
     * @param value 64자리 소문자 16진수 문자열
     * @return IdempotencyKey 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static IdempotencyKey of(String value) {
        return new IdempotencyKey(value);
    }

    /**
     * 키 값 조회.
     *
     * @return 64자리 hex 문자열
     */
    public String getValue() {
        return value;
    }

    /**
     * 로그/표시용 축약형 (앞 12자).
     *
     * @return 12자리 hex 문자열
     */
    public String shortForm() {
        return value.substring(0, SHORT_FORM_LENGTH);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IdempotencyKey that = (IdempotencyKey) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "IdempotencyKey{" + shortForm() + '}';
    }
}
