package com.ryuqq.flowgate.testkit;

import com.ryuqq.flowgate.core.spi.Clock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Manually driven {@link Clock} for deterministic time-based tests.
 *
 * <p>Time only moves when a test calls {@link #advance(long)} or {@link #set(long)}.
 * Safe to read from multiple threads.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ManualClock implements Clock {

    private final AtomicLong now;

    /**
     * Creates a clock starting at the given epoch millis.
     *
     * @param startMillis initial time
     */
    public ManualClock(long startMillis) {
        this.now = new AtomicLong(startMillis);
    }

    /**
     * Creates a clock starting at a fixed, arbitrary instant.
     */
    public ManualClock() {
        this(1_700_000_000_000L);
    }

    @Override
    public long currentTimeMillis() {
        return now.get();
    }

    /**
     * Moves time forward.
     *
     * @param millis amount to advance (non-negative)
     * @return the new current time
     * @throws IllegalArgumentException if millis is negative
     */
    public long advance(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("millis must be non-negative (current: " + millis + ")");
        }
        return now.addAndGet(millis);
    }

    /**
     * Sets the current time.
     *
     * @param millis new epoch millis
     */
    public void set(long millis) {
        now.set(millis);
    }
}
