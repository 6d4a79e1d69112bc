package com.ryuqq.flowgate.adapter.runner;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.ryuqq.flowgate.core.reconciliation.Link;
import com.ryuqq.flowgate.core.reconciliation.VerificationTask;

import java.io.Closeable;

/**
 * Reconciliation 영속 레코드 JSON 코덱.
 *
 * <p>{@link Link}와 {@link VerificationTask}를 Jackson으로 직렬화합니다. 시각은 epoch 밀리초 숫자로 저장하며,
 * null 필드는 생략합니다. 알 수 없는 필드는 무시하여 이후 버전에서 필드가 추가되어도 읽을 수 있습니다.</p>
 *
 * <p>역직렬화 시 record의 compact constructor 검증이 그대로 적용되므로, 필수 필드가 없거나
 * 상태가 모순된 레코드는 {@link JsonProcessingException}으로 보고됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class ReconciliationJsonCodec {

    private final ObjectMapper mapper;

    ReconciliationJsonCodec() {
        this.mapper = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();
    }

    String encodeLink(Link link) throws JsonProcessingException {
        return mapper.writeValueAsString(link);
    }

    Link decodeLink(String json) throws JsonProcessingException {
        return requireRecord(mapper.readValue(json, Link.class), "link");
    }

    String encodeTask(VerificationTask task) throws JsonProcessingException {
        return mapper.writeValueAsString(task);
    }

    VerificationTask decodeTask(String json) throws JsonProcessingException {
        return requireRecord(mapper.readValue(json, VerificationTask.class), "verification task");
    }

    private static <T> T requireRecord(T value, String kind) throws JsonMappingException {
        if (value == null) {
            throw new JsonMappingException((Closeable) null, "Empty " + kind + " record");
        }
        return value;
    }
}
