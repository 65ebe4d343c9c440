package com.devmanager.orchestrator.handshake;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class TimeoutSupervisorTest {

    TimeoutSupervisor timeouts = new TimeoutSupervisor();

    @AfterEach
    void tearDown() {
        timeouts.shutdown();
    }

    @Test
    void arm_firesOnceAfterDeadline() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);

        timeouts.arm(Duration.ofMillis(50), fired::countDown);

        assertThat(fired.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void cancel_preventsFiring() throws InterruptedException {
        AtomicInteger fired = new AtomicInteger();

        timeouts.arm(Duration.ofMillis(100), fired::incrementAndGet);
        timeouts.cancel();
        Thread.sleep(250);

        assertThat(fired.get()).isZero();
        assertThat(timeouts.isArmed()).isFalse();
    }

    @Test
    void rearm_replacesPreviousDeadline() throws InterruptedException {
        AtomicInteger first  = new AtomicInteger();
        CountDownLatch second = new CountDownLatch(1);

        timeouts.arm(Duration.ofMillis(100), first::incrementAndGet);
        timeouts.arm(Duration.ofMillis(150), second::countDown);

        assertThat(second.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(first.get()).isZero();
    }
}
