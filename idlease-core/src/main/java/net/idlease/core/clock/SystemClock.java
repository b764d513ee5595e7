package net.idlease.core.clock;

import net.idlease.core.spi.Clock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 시스템 시각 기반 Clock.
 * 벽시계가 뒤로 가더라도 이전에 반환한 값보다 작은 값은 반환하지 않는다.
 */
public final class SystemClock implements Clock {
    private final AtomicLong last = new AtomicLong(Long.MIN_VALUE);

    @Override
    public long currentTimeMillis() {
        long now = System.currentTimeMillis();
        return last.accumulateAndGet(now, Math::max);
    }
}
