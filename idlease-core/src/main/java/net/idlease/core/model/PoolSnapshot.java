package net.idlease.core.model;

import java.util.List;
import java.util.SortedMap;

/** 풀 상태의 읽기 전용 사본 (진단/테스트용) */
public record PoolSnapshot(
        List<Integer> available,          // 앞쪽이 다음에 나갈 id
        SortedMap<Integer, Long> leases   // id -> 만료 시각
) {
    public int leasedCount() { return leases.size(); }

    public int availableCount() { return available.size(); }
}
