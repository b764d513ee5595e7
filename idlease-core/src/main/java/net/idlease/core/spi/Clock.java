package net.idlease.core.spi;

/** 현재 시각(epoch millis) 공급자. 테스트에서는 ManualClock 주입 */
@FunctionalInterface
public interface Clock {
    long currentTimeMillis();
}
