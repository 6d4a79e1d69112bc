package com.ryuqq.flowgate.testkit;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ManualClock}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ManualClockTest {

    @Test
    void advance_MovesTimeForward() {
        // Given
        ManualClock clock = new ManualClock(1_000);

        // When
        long now = clock.advance(250);

        // Then
        assertEquals(1_250, now);
        assertEquals(1_250, clock.currentTimeMillis());
    }

    @Test
    void advance_NegativeAmount_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new ManualClock().advance(-1));
    }

    @Test
    void set_OverridesCurrentTime() {
        // Given
        ManualClock clock = new ManualClock();

        // When
        clock.set(42);

        // Then
        assertEquals(42, clock.currentTimeMillis());
    }
}
