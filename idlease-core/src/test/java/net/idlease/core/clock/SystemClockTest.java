package net.idlease.core.clock;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SystemClockTest {

    @Test
    void currentTimeMillis_tracksWallClock_andNeverGoesBackwards() {
        SystemClock clock = new SystemClock();
        long before = System.currentTimeMillis();
        long prev = clock.currentTimeMillis();
        assertTrue(prev >= before);

        for (int i = 0; i < 1_000; i++) {
            long t = clock.currentTimeMillis();
            assertTrue(t >= prev, "clock went backwards: " + t + " < " + prev);
            prev = t;
        }
    }
}
