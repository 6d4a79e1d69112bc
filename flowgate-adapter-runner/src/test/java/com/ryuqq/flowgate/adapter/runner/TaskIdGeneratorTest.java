package com.ryuqq.flowgate.adapter.runner;

import com.ryuqq.flowgate.testkit.ManualClock;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TaskIdGenerator 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TaskIdGeneratorTest {

    @Test
    void nextId_HasPrefixBase36TimeAndSixCharSuffix() {
        // given
        ManualClock clock = new ManualClock(1_700_000_000_000L);
        TaskIdGenerator generator = new TaskIdGenerator(clock, () -> new Random(7));

        // when
        String id = generator.nextId();

        // then
        assertThat(id).matches("task-[0-9a-z]+-[0-9a-z]{6}");
        assertThat(id).startsWith("task-" + Long.toString(1_700_000_000_000L, 36) + "-");
    }

    @Test
    void nextId_SameMillisecond_GeneratesDistinctIds() {
        // given
        TaskIdGenerator generator = new TaskIdGenerator(new ManualClock());

        // when
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1_000; i++) {
            ids.add(generator.nextId());
        }

        // then
        assertThat(ids).hasSize(1_000);
    }
}
