package net.idlease.core.service;

import net.idlease.core.model.LeaseError;
import net.idlease.core.model.LeaseResult;
import net.idlease.core.model.PoolSnapshot;
import net.idlease.core.pool.LeasePool;
import net.idlease.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 식별자 임차 파사드.
 * 연산마다 Clock을 한 번 읽고, 가용 큐와 임차 테이블을 함께 보호하는 단일 락 안에서 풀을 변경한다.
 * 로깅은 락을 푼 뒤에만 한다.
 */
public final class IdAllocator {
    private static final Logger log = LoggerFactory.getLogger(IdAllocator.class);

    private final Lock lock = new ReentrantLock();
    private final LeasePool pool;
    private final Clock clock;

    public IdAllocator(LeasePool pool, Clock clock) {
        this.pool = pool;
        this.clock = clock;
    }

    /** 다음 가용 id 임차 (만료분 sweep 포함) */
    public LeaseResult acquireNext() {
        long now = clock.currentTimeMillis();
        LeaseResult result;
        lock.lock();
        try {
            result = pool.acquire(now);
        } finally {
            lock.unlock();
        }
        if (result instanceof LeaseResult.Denied d && d.error() == LeaseError.NO_ID_AVAILABLE) {
            log.info("Pool exhausted: all {} ids in [{}, {}] are leased", pool.size(), pool.min(), pool.max());
        } else {
            log.debug("acquireNext at {} -> {}", now, result);
        }
        return result;
    }

    /** 하트비트(임차 연장) */
    public LeaseResult heartbeat(int id) {
        long now = clock.currentTimeMillis();
        LeaseResult result;
        lock.lock();
        try {
            result = pool.renew(id, now);
        } finally {
            lock.unlock();
        }
        if (result instanceof LeaseResult.Denied d && d.error() == LeaseError.ID_EXPIRED) {
            log.warn("Heartbeat for id {} arrived after expiry (now={}); id reclaimed, holder may have shared it",
                    id, now);
        } else {
            log.debug("heartbeat({}) at {} -> {}", id, now, result);
        }
        return result;
    }

    public PoolSnapshot snapshot() {
        lock.lock();
        try {
            return pool.snapshot();
        } finally {
            lock.unlock();
        }
    }
}
