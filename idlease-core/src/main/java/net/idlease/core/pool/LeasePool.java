package net.idlease.core.pool;

import net.idlease.core.model.Lease;
import net.idlease.core.model.LeaseError;
import net.idlease.core.model.LeaseResult;
import net.idlease.core.model.PoolSnapshot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * [min, max] 범위 식별자 풀.
 * <p>
 * 모든 id는 항상 가용 큐(FIFO) 또는 임차 테이블(id -> 만료 시각) 중 정확히 한 곳에만 있다.
 * 스레드 안전하지 않음: 동시 접근은 {@link net.idlease.core.service.IdAllocator}가 단일 락으로 직렬화한다.
 * 락 안에서 호출되므로 로깅 등 I/O를 하지 않는다.
 * <p>
 * 알려진 한계: 만료된 임차를 가진 클라이언트 A의 하트비트가 늦게 도착하면, 그 사이 sweep으로 회수되어
 * 클라이언트 B에게 재발급된 같은 id를 연장할 수 있다. 소유자 구분(세대 카운터 등)은 하지 않는다.
 */
public final class LeasePool {
    /** now(epoch millis) + timeout 이 long 범위를 넘지 않도록 하는 상한 */
    public static final long MAX_TIMEOUT_MS = Long.MAX_VALUE / 2;

    private final int min;
    private final int max;
    private final long timeoutMs;

    private final Deque<Integer> available;
    private final TreeMap<Integer, Long> leases = new TreeMap<>();

    public LeasePool(int min, int max, long timeoutMs) {
        if (min > max) {
            throw new IllegalArgumentException("pool min must be <= max: min=" + min + ", max=" + max);
        }
        if ((long) max - min + 1 > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("pool range too large: [" + min + ", " + max + "]");
        }
        if (timeoutMs <= 0 || timeoutMs > MAX_TIMEOUT_MS) {
            throw new IllegalArgumentException("lease timeout must be in (0, " + MAX_TIMEOUT_MS + "] ms: " + timeoutMs);
        }
        this.min = min;
        this.max = max;
        this.timeoutMs = timeoutMs;
        this.available = new ArrayDeque<>(max - min + 1);
        for (int id = min; ; id++) {
            available.addLast(id);
            if (id == max) break;
        }
    }

    /** 만료(expiry <= now) 임차를 id 오름차순으로 가용 큐 뒤에 반환. 회수 건수 리턴 */
    public int sweepExpired(long now) {
        int reclaimed = 0;
        Iterator<Map.Entry<Integer, Long>> it = leases.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Integer, Long> e = it.next();
            if (e.getValue() <= now) {
                it.remove();
                release(e.getKey());
                reclaimed++;
            }
        }
        return reclaimed;
    }

    /** sweep 후 가용 큐 맨 앞 id를 임차. 같은 now로 sweep과 만료 계산을 한다 */
    public LeaseResult acquire(long now) {
        sweepExpired(now);
        Integer id = available.pollFirst();
        if (id == null) {
            return LeaseResult.denied(LeaseError.NO_ID_AVAILABLE);
        }
        long expiresAt = now + timeoutMs;
        Long previous = leases.putIfAbsent(id, expiresAt);
        if (previous != null) {
            throw new IllegalStateException("id " + id + " was queued as available while leased until " + previous);
        }
        return LeaseResult.granted(new Lease(id, expiresAt));
    }

    /** 임차 연장. 이미 만료된 임차는 그 자리에서 회수하고 ID_EXPIRED */
    public LeaseResult renew(int id, long now) {
        Long expiresAt = leases.get(id);
        if (expiresAt == null) {
            return LeaseResult.denied(LeaseError.ID_NONEXISTENT);
        }
        if (expiresAt > now) {
            long renewed = now + timeoutMs;
            leases.put(id, renewed);
            return LeaseResult.granted(new Lease(id, renewed));
        }
        leases.remove(id);
        release(id);
        return LeaseResult.denied(LeaseError.ID_EXPIRED);
    }

    public PoolSnapshot snapshot() {
        return new PoolSnapshot(
                Collections.unmodifiableList(new ArrayList<>(available)),
                Collections.unmodifiableSortedMap(new TreeMap<>(leases)));
    }

    public int min() { return min; }

    public int max() { return max; }

    public int size() { return max - min + 1; }

    // 테이블에서 이미 제거된 id만 넘어온다
    private void release(int id) {
        if (id < min || id > max) {
            throw new IllegalStateException("id " + id + " outside pool range [" + min + ", " + max + "]");
        }
        if (available.size() + leases.size() >= size()) {
            throw new IllegalStateException("partition broken while releasing id " + id
                    + ": available=" + available.size() + ", leased=" + leases.size() + ", size=" + size());
        }
        available.addLast(id);
    }
}
