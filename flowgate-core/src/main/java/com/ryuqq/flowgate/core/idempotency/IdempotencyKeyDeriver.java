package com.ryuqq.flowgate.core.idempotency;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.ryuqq.flowgate.core.model.IdempotencyKey;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * 멱등성 키 도출기.
 *
 * <p>(텍스트, 온톨로지 ID, 온톨로지 버전, 파라미터) 조합을 결정적인 {@link IdempotencyKey}로 변환합니다.
 * 상태가 없는 순수 함수 집합이며, 동기화 없이 동시 호출해도 안전합니다.</p>
 *
 * <p><strong>키 공식:</strong></p>
 * <pre>
 * key = sha256_hex(
 *     normalize(text) + "|" + ontologyId + "|" + ontologyVersion + "|" + hashParams(params)
 * )
 * </pre>
 *
 * <p><strong>보장 사항:</strong></p>
 * <ul>
 *   <li>결정성: 동일 입력은 프로세스와 무관하게 항상 동일한 키</li>
 *   <li>텍스트의 대소문자/공백 차이는 키에 영향 없음 (NBSP, U+2028 등 유니코드 공백 포함)</li>
 *   <li>파라미터 선언 순서는 키에 영향 없음</li>
 *   <li>정수값 실수는 정수와 같은 키 ({@code 1}과 {@code 1.0}은 동일)</li>
 *   <li>온톨로지 내용이 바뀌면 {@link #ontologyVersion(String)}이 바뀌어 모든 키가 무효화됨</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * String version = IdempotencyKeyDeriver.ontologyVersion(ontologyTurtle);
 * IdempotencyKey key = IdempotencyKeyDeriver.computeKey(
 *     "John works at Apple.", "foaf", version, Map.of("model", "gpt-4o", "temperature", 0)
 * );
 * cache.get(key.getValue());
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class IdempotencyKeyDeriver {

    /**
     * 파라미터가 없을 때 사용하는 고정 마커 (해시값이 아님).
     */
    public static final String EMPTY_PARAMS_HASH = "0000000000000000";

    private static final int PARAMS_HASH_LENGTH = 16;
    private static final int DOCUMENT_ID_LENGTH = 12;
    private static final String SEPARATOR = "|";
    private static final Pattern WHITESPACE_RUN = Pattern.compile("[\\s\\uFEFF]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final double MAX_PLAIN_INTEGER = 1e21;

    private static final ObjectMapper CANONICAL_JSON = JsonMapper.builder()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .addModule(new SimpleModule("canonical-numbers")
            .addSerializer(Double.class, new CanonicalNumberSerializer())
            .addSerializer(Double.TYPE, new CanonicalNumberSerializer())
            .addSerializer(Float.class, new CanonicalNumberSerializer())
            .addSerializer(Float.TYPE, new CanonicalNumberSerializer()))
        .build();

    private IdempotencyKeyDeriver() {
    }

    /**
     * 텍스트 정규화.
     *
     * <p>앞뒤 공백 제거, 소문자 변환(Locale 독립), 연속 공백(개행 포함)을 단일 공백으로 축약합니다.
     * 공백은 유니코드 White_Space 문자와 BOM(U+FEFF)입니다.</p>
     *
     * @param text 원본 텍스트
     * @return 정규화된 텍스트
     * @throws IllegalArgumentException text가 null인 경우
     */
    public static String normalize(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        String collapsed = WHITESPACE_RUN.matcher(text).replaceAll(" ");
        return collapsed.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * 파라미터 해시 (16자리 hex).
     *
     * <p><strong>알고리즘:</strong></p>
     * <ol>
     *   <li>값이 null인 항목 제외</li>
     *   <li>키 이름 오름차순 정렬</li>
     *   <li>{@code key:jsonValue} 형태로 변환 후 {@code |}로 연결</li>
     *   <li>SHA-256 hex 앞 16자</li>
     * </ol>
     *
     * <p>남은 항목이 없으면 {@link #EMPTY_PARAMS_HASH}를 반환합니다.</p>
     *
     * <p>{@code double}/{@code float} 값은 정수값이면 정수로 기록하고(1.0 → {@code 1}),
     * NaN과 무한대는 {@code null}로 기록합니다.</p>
     *
     * @param params 파라미터 (null 허용, 빈 파라미터로 취급)
     * @return 16자리 hex 문자열
     * @throws IllegalArgumentException 값이 JSON으로 직렬화되지 않는 경우
     */
    public static String hashParams(Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return EMPTY_PARAMS_HASH;
        }

        TreeMap<String, Object> sorted = new TreeMap<>();
        for (Map.Entry<String, ?> entry : params.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                sorted.put(entry.getKey(), entry.getValue());
            }
        }
        if (sorted.isEmpty()) {
            return EMPTY_PARAMS_HASH;
        }

        StringJoiner joiner = new StringJoiner(SEPARATOR);
        for (Map.Entry<String, Object> entry : sorted.entrySet()) {
            joiner.add(entry.getKey() + ":" + toJson(entry.getKey(), entry.getValue()));
        }
        return sha256Hex(joiner.toString()).substring(0, PARAMS_HASH_LENGTH);
    }

    /**
     * 멱등성 키 계산.
     *
     * @param text 처리 대상 텍스트
     * @param ontologyId 온톨로지 식별자
     * @param ontologyVersion 온톨로지 버전 ({@link #ontologyVersion(String)} 결과)
     * @param params 처리 파라미터 (null 허용)
     * @return 64자리 IdempotencyKey
     * @throws IllegalArgumentException text, ontologyId, ontologyVersion이 null인 경우
     */
    public static IdempotencyKey computeKey(
        String text,
        String ontologyId,
        String ontologyVersion,
        Map<String, ?> params
    ) {
        if (ontologyId == null) {
            throw new IllegalArgumentException("ontologyId cannot be null");
        }
        if (ontologyVersion == null) {
            throw new IllegalArgumentException("ontologyVersion cannot be null");
        }

        String material = normalize(text)
            + SEPARATOR + ontologyId
            + SEPARATOR + ontologyVersion
            + SEPARATOR + hashParams(params);
        return IdempotencyKey.of(sha256Hex(material));
    }

    /**
     * 온톨로지 버전 계산 (내용 기반 주소).
     *
     * <p>온톨로지 내용이 한 글자라도 바뀌면 버전이 바뀌고, 그 버전으로 도출된 모든 키가 무효화됩니다.</p>
     *
     * @param ontologyContent 온톨로지 원문
     * @return 64자리 hex 문자열
     * @throws IllegalArgumentException ontologyContent가 null인 경우
     */
    public static String ontologyVersion(String ontologyContent) {
        if (ontologyContent == null) {
            throw new IllegalArgumentException("ontologyContent cannot be null");
        }
        return sha256Hex(ontologyContent);
    }

    /**
     * 원문 텍스트 기반 문서 ID ({@code doc-} + SHA-256 앞 12자).
     *
     * <p>정규화하지 않은 원문을 해시하므로, 공백만 다른 텍스트는 서로 다른 문서로 취급됩니다.</p>
     *
     * @param text 원문 텍스트
     * @return 문서 ID (예: {@code doc-3f2a9c0b7d1e})
     * @throws IllegalArgumentException text가 null인 경우
     */
    public static String documentId(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        return "doc-" + sha256Hex(text).substring(0, DOCUMENT_ID_LENGTH);
    }

    /**
     * UTF-8 SHA-256 소문자 hex.
     *
     * @param content 입력 문자열
     * @return 64자리 hex 문자열
     */
    public static String sha256Hex(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            // 모든 JVM 구현체는 SHA-256을 제공해야 함
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * 실수를 최단 표기로 쓰되, 정수값은 소수점 없이 기록합니다.
     */
    private static final class CanonicalNumberSerializer extends StdSerializer<Number> {

        CanonicalNumberSerializer() {
            super(Number.class);
        }

        @Override
        public void serialize(Number value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            double d = value.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                gen.writeNull();
            } else if (d == Math.rint(d) && Math.abs(d) < MAX_PLAIN_INTEGER) {
                gen.writeNumber(BigDecimal.valueOf(d).toBigInteger());
            } else if (value instanceof Float) {
                gen.writeNumber(value.floatValue());
            } else {
                gen.writeNumber(d);
            }
        }
    }

    private static String toJson(String key, Object value) {
        try {
            return CANONICAL_JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("param '" + key + "' is not JSON-serializable", e);
        }
    }
}
