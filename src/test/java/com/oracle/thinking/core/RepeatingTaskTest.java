package com.oracle.thinking.core;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RepeatingTaskTest {

    @Test
    void shouldStayInertWithZeroPeriod() {
        AtomicInteger runs = new AtomicInteger();
        RepeatingTask task = RepeatingTask.start("inert", 0, runs::incrementAndGet);

        assertThat(task.isActive()).isFalse();
        task.cancel();
        assertThat(runs.get()).isZero();
    }

    @Test
    void shouldKeepRunningAfterAFailureUntilCancelled() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(3);
        RepeatingTask task = RepeatingTask.start("flaky", 10, () -> {
            latch.countDown();
            throw new IllegalStateException("tick failed");
        });

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        task.cancel();
        task.cancel();
        assertThat(task.isActive()).isFalse();
    }
}
