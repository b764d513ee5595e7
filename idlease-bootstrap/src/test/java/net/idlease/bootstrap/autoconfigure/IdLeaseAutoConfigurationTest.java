package net.idlease.bootstrap.autoconfigure;

import net.idlease.core.clock.ManualClock;
import net.idlease.core.clock.SystemClock;
import net.idlease.core.model.Lease;
import net.idlease.core.model.LeaseResult;
import net.idlease.core.pool.LeasePool;
import net.idlease.core.service.IdAllocator;
import net.idlease.core.spi.Clock;
import net.idlease.integration.spring.web.IdLeaseController;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class IdLeaseAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(IdLeaseAutoConfiguration.class));

    @Test
    void defaults_useSystemClock_andKeepPoolPrivateToAllocator() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(IdAllocator.class);
            assertThat(ctx).hasSingleBean(IdLeaseController.class);
            assertThat(ctx).doesNotHaveBean(LeasePool.class);
            assertThat(ctx.getBean(Clock.class)).isInstanceOf(SystemClock.class);
        });
    }

    @Test
    void defaults_giveFullRangeAndThreeSecondTimeout() {
        runner.withBean(Clock.class, () -> new ManualClock(0))
                .run(ctx -> {
                    IdAllocator allocator = ctx.getBean(IdAllocator.class);
                    assertThat(allocator.snapshot().availableCount()).isEqualTo(65535);

                    assertThat(allocator.acquireNext()).isEqualTo(LeaseResult.granted(new Lease(1, 3000)));
                    var available = allocator.snapshot().available();
                    assertThat(available.get(0)).isEqualTo(2);
                    assertThat(available.get(available.size() - 1)).isEqualTo(65535);
                });
    }

    @Test
    void properties_bindPoolBoundsAndTimeout() {
        runner.withBean(Clock.class, () -> new ManualClock(100))
                .withPropertyValues("idlease.pool.min=10", "idlease.pool.max=12", "idlease.pool.timeout=2000")
                .run(ctx -> {
                    IdAllocator allocator = ctx.getBean(IdAllocator.class);
                    assertThat(allocator.snapshot().available()).containsExactly(10, 11, 12);
                    assertThat(allocator.acquireNext()).isEqualTo(LeaseResult.granted(new Lease(10, 2100)));
                });
    }

    @Test
    void userClock_replacesSystemClock() {
        runner.withBean(Clock.class, () -> new ManualClock(500))
                .withPropertyValues("idlease.pool.max=2", "idlease.pool.timeout=1s")
                .run(ctx -> {
                    LeaseResult r = ctx.getBean(IdAllocator.class).acquireNext();
                    assertThat(r).isEqualTo(LeaseResult.granted(new Lease(1, 1500)));
                });
    }

    @Test
    void invalidBounds_failStartup() {
        runner.withPropertyValues("idlease.pool.min=5", "idlease.pool.max=4")
                .run(ctx -> assertThat(ctx).hasFailed()
                        .getFailure().hasRootCauseInstanceOf(IllegalArgumentException.class));
    }

    @Test
    void oversizedTimeout_failsStartup() {
        runner.withPropertyValues("idlease.pool.timeout=" + Long.MAX_VALUE)
                .run(ctx -> assertThat(ctx).hasFailed()
                        .getFailure().hasRootCauseInstanceOf(IllegalArgumentException.class));
    }
}
