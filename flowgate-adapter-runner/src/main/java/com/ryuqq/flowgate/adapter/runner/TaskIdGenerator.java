package com.ryuqq.flowgate.adapter.runner;

import com.ryuqq.flowgate.core.spi.Clock;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * 검증 작업 ID 생성기.
 *
 * <p>형식: {@code task-<base36 epoch ms>-<base36 6자리 난수>} (예: {@code task-lq2x9k3a-4fz0qk})</p>
 *
 * <p>프로세스 시각과 난수 조합이므로 전역 순서를 보장하지 않습니다.
 * 정렬이 필요하면 작업의 createdAt을 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class TaskIdGenerator {

    static final String PREFIX = "task-";

    private static final int RANDOM_LENGTH = 6;
    private static final int RADIX = 36;

    private final Clock clock;
    private final Supplier<Random> random;

    TaskIdGenerator(Clock clock) {
        this(clock, ThreadLocalRandom::current);
    }

    TaskIdGenerator(Clock clock, Supplier<Random> random) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.clock = clock;
        this.random = random;
    }

    String nextId() {
        StringBuilder id = new StringBuilder(PREFIX)
            .append(Long.toString(clock.currentTimeMillis(), RADIX))
            .append('-');
        Random source = random.get();
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            id.append(Character.forDigit(source.nextInt(RADIX), RADIX));
        }
        return id.toString();
    }
}
