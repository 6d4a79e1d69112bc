package com.ryuqq.flowgate.adapter.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.ryuqq.flowgate.core.reconciliation.Candidate;
import com.ryuqq.flowgate.core.reconciliation.Link;
import com.ryuqq.flowgate.core.reconciliation.TaskStatus;
import com.ryuqq.flowgate.core.reconciliation.VerificationTask;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ReconciliationJsonCodec 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ReconciliationJsonCodecTest {

    private final ReconciliationJsonCodec codec = new ReconciliationJsonCodec();

    @Test
    void task_EncodedAndDecoded_PreservesCandidatesAndStatus() throws JsonProcessingException {
        // given
        VerificationTask task = VerificationTask.pending("task-1", "http://example.org/a", "Ada",
            List.of(new Candidate("Q7259", 72.5, "Ada Lovelace", "English mathematician")), 1_700_000_000_000L)
            .approvedWith("Q7259");

        // when
        VerificationTask decoded = codec.decodeTask(codec.encodeTask(task));

        // then
        assertThat(decoded).isEqualTo(task);
        assertThat(decoded.status()).isEqualTo(TaskStatus.APPROVED);
        assertThat(decoded.candidates().get(0).description()).isEqualTo("English mathematician");
    }

    @Test
    void decodeLink_UnknownFields_AreIgnored() throws JsonProcessingException {
        // given
        String json = "{\"entityIri\":\"http://example.org/a\",\"externalId\":\"Q1\","
            + "\"externalUri\":\"http://www.wikidata.org/entity/Q1\",\"linkedAt\":5,\"verifiedBy\":\"alice\"}";

        // when
        Link link = codec.decodeLink(json);

        // then
        assertThat(link.externalId()).isEqualTo("Q1");
        assertThat(link.linkedAt()).isEqualTo(5);
    }

    @Test
    void decodeTask_ContradictoryState_ThrowsJsonProcessingException() {
        // given
        String json = "{\"id\":\"task-1\",\"entityIri\":\"http://example.org/a\",\"label\":\"A\","
            + "\"createdAt\":1,\"status\":\"APPROVED\"}";

        // when & then
        assertThatThrownBy(() -> codec.decodeTask(json)).isInstanceOf(JsonProcessingException.class);
    }

    @Test
    void decode_NullLiteral_ThrowsJsonProcessingException() {
        assertThatThrownBy(() -> codec.decodeLink("null")).isInstanceOf(JsonProcessingException.class);
        assertThatThrownBy(() -> codec.decodeTask("null")).isInstanceOf(JsonProcessingException.class);
    }
}
