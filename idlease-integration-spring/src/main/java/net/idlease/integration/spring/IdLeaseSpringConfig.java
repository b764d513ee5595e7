package net.idlease.integration.spring;

import net.idlease.core.clock.SystemClock;
import net.idlease.core.service.IdAllocator;
import net.idlease.core.spi.Clock;
import net.idlease.integration.spring.web.IdLeaseController;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class IdLeaseSpringConfig {

    // 기본 Clock. 테스트/앱에서 ManualClock 등으로 교체 가능
    @Bean
    @ConditionalOnMissingBean
    public Clock systemClock() { return new SystemClock(); }

    // HTTP 노출 (/next, /heartbeat/{id})
    @Bean
    @ConditionalOnMissingBean
    public IdLeaseController idLeaseController(IdAllocator allocator) { return new IdLeaseController(allocator); }
}
