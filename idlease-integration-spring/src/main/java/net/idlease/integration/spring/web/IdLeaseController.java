package net.idlease.integration.spring.web;

import net.idlease.core.model.LeaseError;
import net.idlease.core.model.LeaseResult;
import net.idlease.core.service.IdAllocator;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/** 성공/실패 모두 200으로 응답한다. 호출자는 본문 모양(id/exp vs error)으로 구분 */
@RestController
public class IdLeaseController {
    private final IdAllocator allocator;

    public IdLeaseController(IdAllocator allocator) {
        this.allocator = allocator;
    }

    @GetMapping("/next")
    public Object next() {
        return LeasePayloads.toBody(allocator.acquireNext());
    }

    // int 범위를 벗어난 id도 풀에 없는 id이므로 ID_NONEXISTENT
    @GetMapping("/heartbeat/{id}")
    public Object heartbeat(@PathVariable("id") long id) {
        if (id < Integer.MIN_VALUE || id > Integer.MAX_VALUE) {
            return LeasePayloads.toBody(LeaseResult.denied(LeaseError.ID_NONEXISTENT));
        }
        return LeasePayloads.toBody(allocator.heartbeat((int) id));
    }
}
