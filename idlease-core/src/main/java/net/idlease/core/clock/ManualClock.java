package net.idlease.core.clock;

import net.idlease.core.spi.Clock;

import java.util.concurrent.atomic.AtomicLong;

/** 수동 제어 Clock (결정적 테스트용) */
public final class ManualClock implements Clock {
    private final AtomicLong now;

    public ManualClock(long initialMillis) {
        this.now = new AtomicLong(initialMillis);
    }

    /** deltaMs 만큼 전진 (음수 불가) */
    public void advance(long deltaMs) {
        if (deltaMs < 0) {
            throw new IllegalArgumentException("Cannot advance by negative amount: " + deltaMs);
        }
        now.addAndGet(deltaMs);
    }

    public void setTime(long millis) {
        now.set(millis);
    }

    @Override
    public long currentTimeMillis() {
        return now.get();
    }
}
