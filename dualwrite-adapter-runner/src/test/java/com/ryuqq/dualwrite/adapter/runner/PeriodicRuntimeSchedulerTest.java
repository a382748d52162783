package com.ryuqq.dualwrite.adapter.runner;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PeriodicRuntimeScheduler 테스트.
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
class PeriodicRuntimeSchedulerTest {

    @Test
    void start_후_주기적으로_pump_호출() throws InterruptedException {
        // given
        CountDownLatch cycles = new CountDownLatch(3);
        try (PeriodicRuntimeScheduler scheduler = new PeriodicRuntimeScheduler()) {
            scheduler.schedule("retry-queue", cycles::countDown, 10);

            // when
            scheduler.start();

            // then
            assertThat(cycles.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(scheduler.isRunning()).isTrue();
        }
    }

    @Test
    void 사이클_예외가_발생해도_다음_사이클은_계속() throws InterruptedException {
        // given
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch recovered = new CountDownLatch(1);
        try (PeriodicRuntimeScheduler scheduler = new PeriodicRuntimeScheduler()) {
            scheduler.schedule("validation", () -> {
                if (calls.incrementAndGet() == 1) {
                    throw new IllegalStateException("legacy down");
                }
                recovered.countDown();
            }, 10);

            // when
            scheduler.start();

            // then
            assertThat(recovered.await(2, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    void 시작_후_등록된_런타임도_즉시_스케줄() throws InterruptedException {
        CountDownLatch ran = new CountDownLatch(1);
        try (PeriodicRuntimeScheduler scheduler = new PeriodicRuntimeScheduler()) {
            scheduler.start();

            scheduler.schedule("late", ran::countDown, 1000);

            assertThat(ran.await(2, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    void 종료_후_재시작은_예외() throws InterruptedException {
        PeriodicRuntimeScheduler scheduler = new PeriodicRuntimeScheduler();
        scheduler.start();
        scheduler.shutdown();

        assertThat(scheduler.isRunning()).isFalse();
        assertThatThrownBy(scheduler::start)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("shut down");
    }

    @Test
    void 잘못된_주기는_거부() {
        try (PeriodicRuntimeScheduler scheduler = new PeriodicRuntimeScheduler()) {
            assertThatThrownBy(() -> scheduler.schedule("retry-queue", () -> { }, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("intervalMs must be positive");
        }
    }
}
