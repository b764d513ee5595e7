package net.idlease.bootstrap.autoconfigure;

import net.idlease.bootstrap.props.IdLeaseProperties;
import net.idlease.core.pool.LeasePool;
import net.idlease.core.service.IdAllocator;
import net.idlease.core.spi.Clock;
import net.idlease.integration.spring.IdLeaseSpringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

@AutoConfiguration
@EnableConfigurationProperties(IdLeaseProperties.class)
@Import(IdLeaseSpringConfig.class) // integration-spring: clock/controller wiring
public class IdLeaseAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(IdLeaseAutoConfiguration.class);

    // --- 코어 조립 ---
    // LeasePool은 빈으로 노출하지 않는다. 락 없이 접근할 수 없도록 IdAllocator만 풀을 소유

    @Bean
    @ConditionalOnMissingBean
    public IdAllocator idAllocator(IdLeaseProperties props, Clock clock) {
        var pool = props.getPool();
        return new IdAllocator(new LeasePool(pool.getMin(), pool.getMax(), pool.getTimeout().toMillis()), clock);
    }

    @Bean
    public ApplicationRunner idLeaseStartupReport(IdLeaseProperties props) {
        var pool = props.getPool();
        return args -> log.info("IdLease pool ready: ids=[{}, {}] timeoutMs={}",
                pool.getMin(), pool.getMax(), pool.getTimeout().toMillis());
    }
}
